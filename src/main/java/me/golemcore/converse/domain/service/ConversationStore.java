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
import me.golemcore.converse.domain.exception.ConversationNotFoundException;
import me.golemcore.converse.domain.exception.DurablePersistenceException;
import me.golemcore.converse.domain.model.ConversationIdentity;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.ConversationRepositoryPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Dual-tier record of conversations and messages.
 *
 * <p>
 * The durable tier ({@link ConversationRepositoryPort}) is the source of truth
 * for identity; the memory tier ({@link ConversationMemoryTier}) serves
 * low-latency reads and may be ahead by the mutations not yet flushed. Flow:
 * <ul>
 * <li>{@link #findOrCreate} - memory, then durable, then durable-first
 * creation mirrored into memory</li>
 * <li>{@link #appendMessage} - memory immediately, durable asynchronously with
 * duplicate suppression</li>
 * <li>{@link #listForOwner} - merged view, per-field last-writer-wins</li>
 * </ul>
 *
 * <p>
 * When the durable tier fails, the memory copy stays authoritative and the
 * write is retried by {@link #flushPending()}. Durable writes for one
 * conversation are serialized on a lock stripe and always re-resolve the
 * canonical conversation id, so appends racing with a reconciliation merge
 * land on the surviving conversation.
 */
@Service
@Slf4j
public class ConversationStore {

    private static final int MAX_REDIRECT_HOPS = 16;

    private final ConversationRepositoryPort repository;
    private final ConversationMemoryTier memoryTier;
    private final ConverseProperties properties;
    private final ExecutorService durableWriteExecutor;
    private final Clock clock;

    private final Map<String, String> redirects = new ConcurrentHashMap<>();
    private final Object[] writeLocks;

    public ConversationStore(ConversationRepositoryPort repository, ConversationMemoryTier memoryTier,
            ConverseProperties properties, @Qualifier("durableWriteExecutor") ExecutorService durableWriteExecutor,
            Clock clock) {
        this.repository = repository;
        this.memoryTier = memoryTier;
        this.properties = properties;
        this.durableWriteExecutor = durableWriteExecutor;
        this.clock = clock;
        int stripes = Math.max(1, properties.getPersistence().getLockStripes());
        this.writeLocks = new Object[stripes];
        for (int i = 0; i < stripes; i++) {
            writeLocks[i] = new Object();
        }
    }

    // ==================== conversations ====================

    public ConversationRecord findOrCreate(String ownerId, String rawAddress, String channelSessionId) {
        return findOrCreate(ChannelAddressNormalizer.resolve(ownerId, rawAddress), channelSessionId, null);
    }

    public ConversationRecord findOrCreate(ConversationIdentity identity, String channelSessionId,
            String displayNameHint) {
        Optional<ConversationRecord> cached = memoryTier.findByIdentity(identity.key());
        if (cached.isPresent()) {
            ConversationRecord record = cached.get();
            if (memoryTier.isProvisional(record.getId())) {
                record = promoteProvisional(record);
            }
            return linkSession(record, channelSessionId, displayNameHint);
        }

        Optional<ConversationRecord> durable;
        try {
            durable = repository.findByOwnerAndAddress(identity.ownerId(), identity.normalizedAddress());
        } catch (DurablePersistenceException e) {
            log.warn("[Store] durable lookup failed for {}, creating provisional conversation: {}",
                    identity.normalizedAddress(), e.getMessage());
            return memoryTier.mirror(newRecord(identity, channelSessionId, displayNameHint), true);
        }
        if (durable.isPresent()) {
            ConversationRecord mirrored = mirrorDurable(durable.get());
            return linkSession(mirrored, channelSessionId, displayNameHint);
        }

        ConversationRecord candidate = newRecord(identity, channelSessionId, displayNameHint);
        ConversationRecord stored;
        try {
            stored = repository.createIfAbsent(candidate);
        } catch (DurablePersistenceException e) {
            log.warn("[Store] durable create failed for {}, keeping provisional conversation {}: {}",
                    identity.normalizedAddress(), candidate.getId(), e.getMessage());
            return memoryTier.mirror(candidate, true);
        }
        if (stored.getId().equals(candidate.getId())) {
            log.info("[Store] created conversation {} for owner={}, address={}", stored.getId(),
                    identity.ownerId(), identity.normalizedAddress());
        }
        return linkSession(mirrorDurable(stored), channelSessionId, displayNameHint);
    }

    public Optional<ConversationRecord> get(String conversationId) {
        String canonical = canonicalId(conversationId);
        Optional<ConversationRecord> cached = memoryTier.get(canonical);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            return repository.findById(canonical);
        } catch (DurablePersistenceException e) {
            log.warn("[Store] durable read failed for {}: {}", canonical, e.getMessage());
            return Optional.empty();
        }
    }

    public ConversationRecord require(String conversationId) {
        return get(conversationId).orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    /**
     * Conversations of an owner from both tiers, one per normalized address.
     * Each field is taken from the copy that updated it last.
     */
    public List<ConversationRecord> listForOwner(String ownerId, String channelSessionId) {
        List<ConversationRecord> durable;
        try {
            durable = new ArrayList<>(repository.findByOwner(ownerId));
        } catch (DurablePersistenceException e) {
            log.warn("[Store] durable list failed for owner {}, serving memory tier only: {}", ownerId,
                    e.getMessage());
            durable = new ArrayList<>();
        }
        durable.sort(Comparator.comparing(ConversationRecord::getCreatedAt,
                Comparator.nullsLast(Comparator.naturalOrder())));

        Map<String, ConversationRecord> byAddress = new LinkedHashMap<>();
        for (ConversationRecord record : durable) {
            byAddress.merge(record.getNormalizedAddress(), record, ConversationMerging::merged);
        }
        for (ConversationRecord record : memoryTier.forOwner(ownerId)) {
            byAddress.merge(record.getNormalizedAddress(), record, ConversationMerging::merged);
        }

        return byAddress.values().stream()
                .filter(record -> channelSessionId == null
                        || channelSessionId.equals(record.getLinkedChannelSessionId()))
                .sorted(ChannelAddressNormalizer.byRecentActivity())
                .toList();
    }

    public ConversationRecord markRead(String conversationId) {
        ConversationRecord record = require(conversationId);
        String canonical = record.getId();
        Instant now = clock.instant();
        memoryTier.updateRecord(canonical, r -> {
            r.setUnreadCount(0);
            r.setUnreadUpdatedAt(now);
        });
        synchronized (writeLock(canonical)) {
            try {
                repository.findById(canonical).ifPresent(durable -> {
                    durable.setUnreadCount(0);
                    durable.setUnreadUpdatedAt(now);
                    repository.save(durable);
                });
            } catch (DurablePersistenceException e) {
                log.warn("[Store] failed to persist read marker for {}: {}", canonical, e.getMessage());
            }
        }
        record.setUnreadCount(0);
        record.setUnreadUpdatedAt(now);
        return record;
    }

    // ==================== messages ====================

    /**
     * Appends a message to the memory tier now and to the durable tier
     * asynchronously.
     *
     * @return completes with the durable copy (carrying its sequence number),
     *         with empty if the message was suppressed as a duplicate, or
     *         exceptionally if the durable write failed; the memory copy is
     *         kept in that case and flushed later
     */
    public CompletableFuture<Optional<MessageRecord>> appendMessage(String conversationId, MessageRecord message) {
        String canonical = canonicalId(conversationId);
        MessageRecord prepared = message.copy();
        prepared.setConversationId(canonical);
        prepared.setSequenceNumber(0);
        if (prepared.getId() == null || prepared.getId().isBlank()) {
            prepared.setId(UUID.randomUUID().toString());
        }
        if (prepared.getCreatedAt() == null) {
            prepared.setCreatedAt(clock.instant());
        }

        Duration window = properties.getPersistence().getDuplicateWindow();
        ConversationMemoryTier.AppendResult result = memoryTier.append(canonical, prepared, window);
        if (result == ConversationMemoryTier.AppendResult.MISSING) {
            // evicted since the caller looked it up; bring it back from the durable tier
            get(canonical).ifPresent(record -> memoryTier.mirror(record, false));
            result = memoryTier.append(canonical, prepared, window);
        }
        if (result == ConversationMemoryTier.AppendResult.DUPLICATE) {
            log.debug("[Store] duplicate message {} suppressed in memory for {}", prepared.getId(), canonical);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return CompletableFuture.supplyAsync(() -> persistMessage(prepared), durableWriteExecutor);
    }

    /**
     * Messages of a conversation in order: the durable history by sequence
     * number, then cached messages that are not durable yet in arrival order.
     * Channel timestamps are not used for ordering, they can be coarser than
     * the local clock.
     */
    public List<MessageRecord> listMessages(String conversationId) {
        String canonical = canonicalId(conversationId);
        List<MessageRecord> durable;
        try {
            durable = repository.findMessages(canonical);
        } catch (DurablePersistenceException e) {
            log.warn("[Store] durable message read failed for {}, serving memory tier only: {}", canonical,
                    e.getMessage());
            durable = List.of();
        }
        Set<String> durableIds = new HashSet<>();
        for (MessageRecord message : durable) {
            durableIds.add(message.getId());
        }
        Duration mergeWindow = properties.getPersistence().getListMergeWindow();
        List<MessageRecord> result = new ArrayList<>(durable);
        result.sort(Comparator.comparingLong(MessageRecord::getSequenceNumber));
        for (MessageRecord cached : memoryTier.messages(canonical)) {
            if (durableIds.contains(cached.getId())) {
                continue;
            }
            boolean echoed = durable.stream()
                    .anyMatch(d -> d.getRole() == cached.getRole()
                            && MessageDeduplication.isSameContentWithin(d, cached, mergeWindow));
            if (!echoed) {
                result.add(cached);
            }
        }
        return result;
    }

    public void updateDeliveryStatus(String conversationId, String messageId, DeliveryStatus status,
            Map<String, Object> metadata) {
        String canonical = canonicalId(conversationId);
        memoryTier.updateDeliveryStatus(canonical, messageId, status, metadata);
        synchronized (writeLock(canonical)) {
            try {
                repository.updateDeliveryStatus(canonical, messageId, status, metadata);
            } catch (DurablePersistenceException e) {
                log.warn("[Store] failed to persist delivery status {} for message {}: {}", status, messageId,
                        e.getMessage());
            }
        }
    }

    // ==================== summaries ====================

    public Optional<ConversationSummary> getSummary(String conversationId) {
        String canonical = canonicalId(conversationId);
        Optional<ConversationSummary> cached = memoryTier.summary(canonical);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            Optional<ConversationSummary> durable = repository.findSummary(canonical);
            durable.ifPresent(summary -> memoryTier.putSummary(canonical, summary));
            return durable;
        } catch (DurablePersistenceException e) {
            log.warn("[Store] summary read failed for {}: {}", canonical, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Overwrites the conversation's summary if the new one covers more turns.
     *
     * @return false if an equal or more advanced summary already exists
     */
    public boolean updateSummary(String conversationId, ConversationSummary summary) {
        String canonical = canonicalId(conversationId);
        summary.setConversationId(canonical);
        synchronized (writeLock(canonical)) {
            try {
                Optional<ConversationSummary> existing = repository.findSummary(canonical);
                if (existing.isPresent() && existing.get().getCoveredThroughSequenceNumber() >= summary
                        .getCoveredThroughSequenceNumber()) {
                    memoryTier.putSummary(canonical, existing.get());
                    return false;
                }
                repository.saveSummary(summary);
            } catch (DurablePersistenceException e) {
                log.warn("[Store] failed to persist summary for {}, keeping it in memory: {}", canonical,
                        e.getMessage());
            }
        }
        return memoryTier.putSummary(canonical, summary);
    }

    // ==================== reconciliation support ====================

    /**
     * Records that {@code supersededId} was merged into {@code canonical} and
     * moves any cached state over.
     */
    public void redirect(String supersededId, ConversationRecord canonical) {
        if (supersededId.equals(canonical.getId())) {
            return;
        }
        redirects.put(supersededId, canonical.getId());
        memoryTier.rekey(supersededId, canonical);
    }

    /**
     * Merges a duplicate durable conversation into its canonical one: new
     * appends are redirected first, then messages are re-parented and the
     * duplicate shell is deleted. Message content is never modified.
     *
     * @return number of messages moved
     */
    public int absorb(ConversationRecord superseded, ConversationRecord canonical) {
        // stripes are always taken in index order
        int a = stripeIndex(superseded.getId());
        int b = stripeIndex(canonical.getId());
        Object first = writeLocks[Math.min(a, b)];
        Object second = writeLocks[Math.max(a, b)];
        synchronized (first) {
            synchronized (second) {
                redirect(superseded.getId(), canonical);

                Optional<ConversationSummary> summary = repository.findSummary(canonical.getId());
                String coveredMessageId = summary
                        .flatMap(s -> findIdBySequence(canonical.getId(), s.getCoveredThroughSequenceNumber()))
                        .orElse(null);

                int moved = repository.reparentMessages(superseded.getId(), canonical.getId());

                List<MessageRecord> merged = repository.findMessages(canonical.getId());
                for (MessageRecord message : merged) {
                    memoryTier.assignSequence(canonical.getId(), message.getId(), message.getSequenceNumber());
                }
                if (summary.isPresent() && coveredMessageId != null) {
                    // interleaving shifts sequence numbers forward, keep the summary on the same turn
                    merged.stream()
                            .filter(m -> m.getId().equals(coveredMessageId))
                            .findFirst()
                            .ifPresent(m -> {
                                ConversationSummary shifted = summary.get();
                                shifted.setCoveredThroughSequenceNumber(m.getSequenceNumber());
                                repository.saveSummary(shifted);
                                memoryTier.putSummary(canonical.getId(), shifted);
                            });
                }

                repository.findById(canonical.getId()).ifPresent(record -> {
                    ConversationMerging.mergeInto(record, superseded);
                    repository.save(record);
                });
                repository.delete(superseded.getId());
                return moved;
            }
        }
    }

    public String canonicalId(String conversationId) {
        String current = conversationId;
        for (int hop = 0; hop < MAX_REDIRECT_HOPS; hop++) {
            String next = redirects.get(current);
            if (next == null) {
                return current;
            }
            current = next;
        }
        log.warn("[Store] redirect chain too long from {}", conversationId);
        return current;
    }

    /**
     * Retries durable writes for provisional conversations and messages that
     * only exist in memory.
     *
     * @return number of messages flushed
     */
    public int flushPending() {
        int flushed = 0;
        for (String conversationId : memoryTier.dirtyConversationIds()) {
            Optional<ConversationRecord> record = memoryTier.get(conversationId);
            if (record.isEmpty()) {
                continue;
            }
            String targetId = conversationId;
            if (memoryTier.isProvisional(conversationId)) {
                ConversationRecord promoted = promoteProvisional(record.get());
                if (memoryTier.isProvisional(promoted.getId())) {
                    continue;
                }
                targetId = promoted.getId();
            }
            for (MessageRecord message : memoryTier.messages(targetId)) {
                if (message.isDurable()) {
                    continue;
                }
                try {
                    persistMessage(message);
                    flushed++;
                } catch (RuntimeException e) {
                    log.warn("[Store] flush of message {} failed: {}", message.getId(), e.getMessage());
                    break;
                }
            }
        }
        if (flushed > 0) {
            log.info("[Store] flushed {} pending messages", flushed);
        }
        return flushed;
    }

    // ==================== internals ====================

    private Optional<MessageRecord> persistMessage(MessageRecord message) {
        String canonical = canonicalId(message.getConversationId());
        synchronized (writeLock(canonical)) {
            // a merge may have completed while this write was queued
            canonical = canonicalId(canonical);
            try {
                canonical = ensureDurableConversation(canonical);
                message.setConversationId(canonical);

                Duration window = properties.getPersistence().getDuplicateWindow();
                for (MessageRecord existing : repository.findMessages(canonical)) {
                    if (existing.getId().equals(message.getId())) {
                        memoryTier.assignSequence(canonical, message.getId(), existing.getSequenceNumber());
                        return Optional.empty();
                    }
                    if (MessageDeduplication.isSameContentWithin(existing, message, window)) {
                        log.debug("[Store] message {} duplicates durable message {}, skipped", message.getId(),
                                existing.getId());
                        memoryTier.discard(canonical, message.getId());
                        return Optional.empty();
                    }
                }

                Optional<MessageRecord> stored = repository.insertMessageIfAbsent(message);
                if (stored.isEmpty()) {
                    return Optional.empty();
                }
                MessageRecord durable = stored.get();
                memoryTier.assignSequence(canonical, durable.getId(), durable.getSequenceNumber());

                repository.findById(canonical).ifPresent(record -> {
                    ConversationMemoryTier.applyMessageToRecord(record, durable);
                    record.setUpdatedAt(clock.instant());
                    repository.save(record);
                });
                log.debug("[Store] persisted message {} as #{} in {}", durable.getId(), durable.getSequenceNumber(),
                        canonical);
                return Optional.of(durable);
            } catch (DurablePersistenceException e) {
                log.warn("[Store] durable write failed for message {}, kept in memory until next flush: {}",
                        message.getId(), e.getMessage());
                throw new CompletionException(e);
            }
        }
    }

    /**
     * Makes sure the conversation exists durably, creating a provisional one or
     * following it to the conversation that now owns its address.
     *
     * @return the durable conversation id to write to
     */
    private String ensureDurableConversation(String conversationId) {
        if (repository.findById(conversationId).isPresent()) {
            return conversationId;
        }
        ConversationRecord cached = memoryTier.get(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        ConversationRecord stored = repository.createIfAbsent(cached);
        if (!stored.getId().equals(conversationId)) {
            log.info("[Store] conversation {} was superseded by {}, following it", conversationId, stored.getId());
            redirect(conversationId, stored);
        } else {
            memoryTier.markDurable(conversationId);
        }
        return stored.getId();
    }

    private ConversationRecord promoteProvisional(ConversationRecord record) {
        try {
            ConversationRecord stored = repository.createIfAbsent(record);
            if (!stored.getId().equals(record.getId())) {
                log.info("[Store] provisional conversation {} reconciled onto durable {}", record.getId(),
                        stored.getId());
                redirect(record.getId(), stored);
                return memoryTier.get(stored.getId()).orElse(stored);
            }
            memoryTier.markDurable(record.getId());
            return record;
        } catch (DurablePersistenceException e) {
            log.debug("[Store] conversation {} still provisional: {}", record.getId(), e.getMessage());
            return record;
        }
    }

    private ConversationRecord mirrorDurable(ConversationRecord durable) {
        ConversationRecord mirrored = memoryTier.mirror(durable, false);
        if (!mirrored.getId().equals(durable.getId())) {
            // memory raced ahead with another id for the same address
            redirect(mirrored.getId(), durable);
            return memoryTier.get(durable.getId()).orElse(durable);
        }
        return mirrored;
    }

    private ConversationRecord linkSession(ConversationRecord record, String channelSessionId,
            String displayNameHint) {
        boolean relink = channelSessionId != null && !channelSessionId.equals(record.getLinkedChannelSessionId());
        boolean rename = displayNameHint != null && !displayNameHint.isBlank()
                && (record.getDisplayName() == null || record.getDisplayName()
                        .equals(ChannelAddressNormalizer.displayName(record.getNormalizedAddress())));
        if (!relink && !rename) {
            return record;
        }
        Instant now = clock.instant();
        ConversationRecord updated = memoryTier.updateRecord(record.getId(), r -> {
            if (relink) {
                r.setLinkedChannelSessionId(channelSessionId);
            }
            if (rename) {
                r.setDisplayName(displayNameHint.trim());
            }
            r.setUpdatedAt(now);
        }).orElse(record);
        if (!memoryTier.isProvisional(updated.getId())) {
            synchronized (writeLock(updated.getId())) {
                try {
                    repository.findById(updated.getId()).ifPresent(durable -> {
                        if (relink) {
                            durable.setLinkedChannelSessionId(channelSessionId);
                        }
                        if (rename) {
                            durable.setDisplayName(displayNameHint.trim());
                        }
                        durable.setUpdatedAt(now);
                        repository.save(durable);
                    });
                } catch (DurablePersistenceException e) {
                    log.warn("[Store] failed to persist link update for {}: {}", updated.getId(), e.getMessage());
                }
            }
        }
        return updated;
    }

    private ConversationRecord newRecord(ConversationIdentity identity, String channelSessionId,
            String displayNameHint) {
        Instant now = clock.instant();
        String displayName = displayNameHint != null && !displayNameHint.isBlank()
                ? displayNameHint.trim()
                : ChannelAddressNormalizer.displayName(identity.normalizedAddress());
        return ConversationRecord.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(identity.ownerId())
                .normalizedAddress(identity.normalizedAddress())
                .displayName(displayName)
                .group(identity.group())
                .linkedChannelSessionId(channelSessionId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Optional<String> findIdBySequence(String conversationId, long sequenceNumber) {
        return repository.findMessages(conversationId).stream()
                .filter(m -> m.getSequenceNumber() == sequenceNumber)
                .map(MessageRecord::getId)
                .findFirst();
    }

    private Object writeLock(String conversationId) {
        return writeLocks[stripeIndex(conversationId)];
    }

    private int stripeIndex(String conversationId) {
        return Math.floorMod(conversationId.hashCode(), writeLocks.length);
    }
}
