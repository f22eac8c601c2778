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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.loop.ConversationPipeline;
import me.golemcore.converse.domain.model.ConversationIdentity.IdentityKey;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.PipelineOutcome;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs {@link ConversationPipeline} one message at a time per conversation
 * partner.
 *
 * <p>
 * Messages for the same {@code (ownerId, normalizedAddress)} are processed in
 * arrival order; different partners are processed concurrently on the shared
 * worker pool. A message whose channel id is already queued or running is
 * ignored. Each partner queues at most
 * {@code converse.pipeline.max-queued-per-identity} messages, dropping the
 * oldest beyond that.
 */
@Service
@Slf4j
public class IdentityRunCoordinator {

    private final ConversationPipeline pipeline;
    private final ExecutorService conversationRunExecutor;
    private final ConverseProperties properties;

    private final Map<IdentityKey, IdentityRunner> runners = new ConcurrentHashMap<>();
    private final Set<String> inFlightMessageIds = ConcurrentHashMap.newKeySet();

    public IdentityRunCoordinator(ConversationPipeline pipeline,
            @Qualifier("conversationRunExecutor") ExecutorService conversationRunExecutor,
            ConverseProperties properties) {
        this.pipeline = pipeline;
        this.conversationRunExecutor = conversationRunExecutor;
        this.properties = properties;
    }

    public void enqueue(InboundMessage inbound) {
        Objects.requireNonNull(inbound, "inbound");
        String messageId = inbound.getMessageId();
        if (messageId != null && !inFlightMessageIds.add(messageId)) {
            log.debug("[IdentityRunCoordinator] message {} already in flight, ignored", messageId);
            return;
        }
        IdentityKey key = keyOf(inbound);
        IdentityRunner runner = runners.computeIfAbsent(key, IdentityRunner::new);
        runner.enqueue(inbound);
    }

    int activeRunners() {
        return runners.size();
    }

    static IdentityKey keyOf(InboundMessage inbound) {
        String owner = inbound.getOwnerId() != null ? inbound.getOwnerId() : "";
        return new IdentityKey(owner, ChannelAddressNormalizer.normalize(inbound.getRawAddress()));
    }

    private void release(InboundMessage inbound) {
        if (inbound.getMessageId() != null) {
            inFlightMessageIds.remove(inbound.getMessageId());
        }
    }

    private final class IdentityRunner {

        private final IdentityKey key;
        private final Object lock = new Object();
        private final Deque<InboundMessage> queued = new ArrayDeque<>();

        private Future<?> runningTask;
        private boolean retired;

        private IdentityRunner(IdentityKey key) {
            this.key = key;
        }

        void enqueue(InboundMessage inbound) {
            synchronized (lock) {
                if (retired) {
                    // evicted between lookup and enqueue; hand over to a fresh runner
                    runners.computeIfAbsent(key, IdentityRunner::new).enqueue(inbound);
                    return;
                }
                if (isRunning()) {
                    enqueueWithBound(inbound);
                    return;
                }
                startRun(inbound);
            }
        }

        private boolean isRunning() {
            return runningTask != null && !runningTask.isDone();
        }

        private void enqueueWithBound(InboundMessage inbound) {
            int limit = Math.max(1, properties.getPipeline().getMaxQueuedPerIdentity());
            if (queued.size() >= limit) {
                InboundMessage dropped = queued.removeFirst();
                release(dropped);
                log.warn("[IdentityRunCoordinator] queue limit reached ({}), dropped oldest message {}: owner={}, "
                        + "address={}", limit, dropped.getMessageId(), key.ownerId(), key.normalizedAddress());
            }
            queued.addLast(inbound);
        }

        private void startRun(InboundMessage inbound) {
            runningTask = conversationRunExecutor.submit(() -> {
                try {
                    PipelineOutcome outcome = pipeline.processMessage(inbound);
                    log.debug("[IdentityRunCoordinator] message {} -> {}", inbound.getMessageId(), outcome);
                } catch (Exception e) { // NOSONAR - must not kill executor thread
                    log.error("[IdentityRunCoordinator] run failed: owner={}, address={}: {}",
                            key.ownerId(), key.normalizedAddress(), e.getMessage(), e);
                } finally {
                    release(inbound);
                    onRunComplete();
                }
            });
        }

        private void onRunComplete() {
            synchronized (lock) {
                runningTask = null;
                InboundMessage next = queued.pollFirst();
                if (next != null) {
                    startRun(next);
                    return;
                }
                retired = runners.remove(key, this);
                if (retired) {
                    log.trace("[IdentityRunCoordinator] evicted idle runner: owner={}, address={}",
                            key.ownerId(), key.normalizedAddress());
                }
            }
        }
    }
}
