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
import me.golemcore.converse.domain.exception.DurablePersistenceException;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ReconciliationReport;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.ConversationRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Merges duplicate conversations created by racing inbound events.
 *
 * <p>
 * For each owner, durable conversations are grouped by normalized address.
 * In a group with more than one member the oldest-created conversation is
 * kept; the others are absorbed into it through
 * {@link ConversationStore#absorb}, which redirects in-flight appends before
 * moving any message. Runs on demand and on a fixed delay
 * ({@code converse.reconciliation.interval}); a pass never overlaps another.
 */
@Service
@Slf4j
public class ConversationReconciliationService {

    private static final Comparator<ConversationRecord> OLDEST_FIRST = Comparator
            .comparing(ConversationRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ConversationRecord::getId);

    private final ConversationRepositoryPort repository;
    private final ConversationStore store;
    private final ConverseProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> passTask;

    public ConversationReconciliationService(ConversationRepositoryPort repository, ConversationStore store,
            ConverseProperties properties) {
        this.repository = repository;
        this.store = store;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ConverseProperties.ReconciliationProperties config = properties.getReconciliation();
        if (!config.isEnabled()) {
            log.info("[Reconcile] Periodic reconciliation disabled");
            return;
        }
        Duration interval = config.getInterval();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conversation-reconciler");
            t.setDaemon(true);
            return t;
        });
        passTask = scheduler.scheduleWithFixedDelay(this::scheduledPass, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("[Reconcile] Started with interval: {}", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (passTask != null) {
            passTask.cancel(false);
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
    }

    public ReconciliationReport reconcileAll() {
        List<String> owners;
        try {
            owners = repository.findOwnerIds();
        } catch (DurablePersistenceException e) {
            log.warn("[Reconcile] Cannot list owners: {}", e.getMessage());
            return ReconciliationReport.empty(null);
        }
        int groups = 0;
        int moved = 0;
        Map<String, String> redirects = new LinkedHashMap<>();
        for (String ownerId : owners) {
            ReconciliationReport report = reconcileOwner(ownerId);
            groups += report.mergedGroups();
            moved += report.messagesReparented();
            redirects.putAll(report.redirects());
        }
        return new ReconciliationReport(null, groups, moved, redirects);
    }

    public ReconciliationReport reconcileOwner(String ownerId) {
        List<ConversationRecord> conversations;
        try {
            conversations = repository.findByOwner(ownerId);
        } catch (DurablePersistenceException e) {
            log.warn("[Reconcile] Cannot list conversations of owner {}: {}", ownerId, e.getMessage());
            return ReconciliationReport.empty(ownerId);
        }

        Map<String, List<ConversationRecord>> byAddress = new LinkedHashMap<>();
        for (ConversationRecord conversation : conversations) {
            byAddress.computeIfAbsent(conversation.getNormalizedAddress(), k -> new ArrayList<>()).add(conversation);
        }

        int mergedGroups = 0;
        int moved = 0;
        Map<String, String> redirects = new LinkedHashMap<>();
        for (Map.Entry<String, List<ConversationRecord>> group : byAddress.entrySet()) {
            List<ConversationRecord> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            members.sort(OLDEST_FIRST);
            ConversationRecord canonical = members.get(0);
            boolean mergedAny = false;
            for (ConversationRecord duplicate : members.subList(1, members.size())) {
                try {
                    moved += store.absorb(duplicate, canonical);
                    redirects.put(duplicate.getId(), canonical.getId());
                    mergedAny = true;
                    log.info("[Reconcile] Merged conversation {} into {} (owner={}, address={})",
                            duplicate.getId(), canonical.getId(), ownerId, group.getKey());
                } catch (DurablePersistenceException e) {
                    log.warn("[Reconcile] Failed to merge {} into {}: {}", duplicate.getId(), canonical.getId(),
                            e.getMessage());
                }
            }
            if (mergedAny) {
                mergedGroups++;
            }
        }
        if (mergedGroups > 0) {
            log.info("[Reconcile] Owner {}: merged {} duplicate groups, moved {} messages", ownerId, mergedGroups,
                    moved);
        }
        return new ReconciliationReport(ownerId, mergedGroups, moved, redirects);
    }

    void scheduledPass() {
        if (!running.compareAndSet(false, true)) {
            log.debug("[Reconcile] Pass skipped: previous pass still in progress");
            return;
        }
        try {
            reconcileAll();
        } catch (Exception e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Reconcile] Pass failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
