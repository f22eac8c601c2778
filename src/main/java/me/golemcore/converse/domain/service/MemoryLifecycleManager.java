package me.golemcore.converse.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.MemoryStats;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the memory tier bounded.
 *
 * <p>
 * A single daemon thread sweeps at a fixed rate
 * ({@code converse.memory.sweep-interval}). Each sweep:
 * <ol>
 * <li>flushes pending durable writes, holding no memory lock during I/O</li>
 * <li>evicts conversations idle for longer than the TTL</li>
 * <li>evicts the least recently active conversations while over the cap</li>
 * <li>trims each remaining conversation to its newest messages</li>
 * </ol>
 *
 * <p>
 * Eviction only discards the cached copy. Conversations with unflushed state
 * are kept until a flush succeeds. If a sweep is still running when the next
 * tick fires, the tick is skipped.
 */
@Component
@Slf4j
public class MemoryLifecycleManager {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ConversationMemoryTier memoryTier;
    private final ConversationStore store;
    private final ConverseProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public MemoryLifecycleManager(ConversationMemoryTier memoryTier, ConversationStore store,
            ConverseProperties properties, Clock clock) {
        this.memoryTier = memoryTier;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-lifecycle");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = properties.getMemory().getSweepInterval().toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Lifecycle] Started with sweep interval: {}", properties.getMemory().getSweepInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Lifecycle] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Lifecycle] Tick skipped: previous sweep still in progress");
            return;
        }
        try {
            sweep();
        } catch (Exception e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Lifecycle] Sweep failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Runs one sweep synchronously.
     */
    public SweepResult sweep() {
        ConverseProperties.MemoryProperties config = properties.getMemory();
        int flushed = store.flushPending();

        Instant cutoff = clock.instant().minus(config.getConversationTtl());
        int expired = 0;
        for (ConversationMemoryTier.EntrySnapshot entry : memoryTier.snapshot()) {
            if (entry.lastActivityAt().isBefore(cutoff) && memoryTier.evict(entry.conversationId())) {
                expired++;
            }
        }

        int overCap = 0;
        int excess = memoryTier.size() - config.getMaxConversations();
        if (excess > 0) {
            List<ConversationMemoryTier.EntrySnapshot> oldestFirst = memoryTier.snapshot().stream()
                    .filter(entry -> !entry.dirty())
                    .sorted(Comparator.comparing(ConversationMemoryTier.EntrySnapshot::lastActivityAt))
                    .toList();
            for (ConversationMemoryTier.EntrySnapshot entry : oldestFirst) {
                if (overCap >= excess) {
                    break;
                }
                if (memoryTier.evict(entry.conversationId())) {
                    overCap++;
                }
            }
        }

        int trimmed = 0;
        for (ConversationMemoryTier.EntrySnapshot entry : memoryTier.snapshot()) {
            if (entry.messageCount() > config.getMaxMessagesPerConversation()) {
                trimmed += memoryTier.trim(entry.conversationId(), config.getMaxMessagesPerConversation());
            }
        }

        SweepResult result = new SweepResult(flushed, expired, overCap, trimmed);
        if (result.changedAnything()) {
            log.info("[Lifecycle] Sweep: flushed={}, expired={}, evictedOverCap={}, trimmedMessages={}",
                    flushed, expired, overCap, trimmed);
        }
        if (memoryTier.size() > config.getMaxConversations()) {
            log.warn("[Lifecycle] Memory tier still holds {} conversations (cap {}) with unflushed state",
                    memoryTier.size(), config.getMaxConversations());
        }
        return result;
    }

    public MemoryStats stats() {
        ConverseProperties.MemoryProperties config = properties.getMemory();
        int conversations = memoryTier.size();
        int messages = memoryTier.messageCount();
        long bytes = conversations * config.getBytesPerConversation() + messages * config.getBytesPerMessage();
        return MemoryStats.builder()
                .conversationCount(conversations)
                .messageCount(messages)
                .averageMessagesPerConversation(conversations > 0 ? (double) messages / conversations : 0.0)
                .estimatedBytes(bytes)
                .estimatedMemory(String.format(Locale.ROOT, "%.2f MB", bytes / BYTES_PER_MB))
                .build();
    }

    /**
     * Counts of what one sweep did.
     */
    public record SweepResult(int flushedMessages, int expiredConversations, int evictedOverCap,
            int trimmedMessages) {

        boolean changedAnything() {
            return flushedMessages > 0 || expiredConversations > 0 || evictedOverCap > 0 || trimmedMessages > 0;
        }
    }
}
