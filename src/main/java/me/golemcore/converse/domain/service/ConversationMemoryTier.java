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
import me.golemcore.converse.domain.model.ConversationIdentity.IdentityKey;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process cache of recent conversations and their latest messages.
 *
 * <p>
 * Entries are keyed by conversation id with a secondary index by identity.
 * Every entry carries its own monitor; readers and writers of one conversation
 * never block other conversations, and the lifecycle sweep only locks one
 * entry at a time. All reads return copies.
 *
 * <p>
 * An entry is <em>dirty</em> while its record is provisional (not yet in the
 * durable tier) or while it holds messages without a sequence number. Dirty
 * entries are never evicted and their unflushed messages are never trimmed.
 */
@Component
@Slf4j
public class ConversationMemoryTier {

    private final Map<String, CachedConversation> entries = new ConcurrentHashMap<>();
    private final Map<IdentityKey, String> identityIndex = new ConcurrentHashMap<>();

    public enum AppendResult {
        APPENDED, DUPLICATE, MISSING
    }

    /**
     * Sweep view of one entry.
     */
    public record EntrySnapshot(String conversationId, Instant lastActivityAt, boolean dirty, int messageCount) {
    }

    public Optional<ConversationRecord> findByIdentity(IdentityKey key) {
        String id = identityIndex.get(key);
        return id != null ? get(id) : Optional.empty();
    }

    public Optional<ConversationRecord> get(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry.evicted ? Optional.empty() : Optional.of(entry.record.copy());
        }
    }

    public boolean isProvisional(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            return !entry.evicted && entry.provisional;
        }
    }

    /**
     * Mirrors a record into memory unless its identity is already cached.
     *
     * @return the cached record for the identity, which is {@code record}
     *         unless another entry already held the identity
     */
    public ConversationRecord mirror(ConversationRecord record, boolean provisional) {
        IdentityKey key = record.identityKey();
        while (true) {
            String existingId = identityIndex.putIfAbsent(key, record.getId());
            if (existingId == null || existingId.equals(record.getId())) {
                break;
            }
            Optional<ConversationRecord> existing = get(existingId);
            if (existing.isPresent()) {
                return existing.get();
            }
            if (identityIndex.replace(key, existingId, record.getId())) {
                break;
            }
        }
        CachedConversation entry = entries.computeIfAbsent(record.getId(),
                id -> new CachedConversation(record.copy(), provisional));
        synchronized (entry) {
            return entry.record.copy();
        }
    }

    /**
     * Applies a mutation to the cached record under the entry lock.
     *
     * @return the updated copy, empty if the conversation is not cached
     */
    public Optional<ConversationRecord> updateRecord(String conversationId, Consumer<ConversationRecord> mutation) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            if (entry.evicted) {
                return Optional.empty();
            }
            mutation.accept(entry.record);
            return Optional.of(entry.record.copy());
        }
    }

    public void markDurable(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry != null) {
            synchronized (entry) {
                entry.provisional = false;
            }
        }
    }

    /**
     * Appends a message unless it duplicates a cached one: same id, or same
     * content created within {@code duplicateWindow}. Updates the record's
     * last-message, unread and presence fields.
     */
    public AppendResult append(String conversationId, MessageRecord message, Duration duplicateWindow) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return AppendResult.MISSING;
        }
        synchronized (entry) {
            if (entry.evicted) {
                return AppendResult.MISSING;
            }
            for (MessageRecord cached : entry.messages) {
                if (MessageDeduplication.isDuplicate(cached, message, duplicateWindow)) {
                    return AppendResult.DUPLICATE;
                }
            }
            MessageRecord copy = message.copy();
            copy.setConversationId(conversationId);
            entry.messages.add(copy);
            applyMessageToRecord(entry.record, copy);
            return AppendResult.APPENDED;
        }
    }

    /**
     * Records the durable sequence number of a cached message.
     */
    public void assignSequence(String conversationId, String messageId, long sequenceNumber) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            for (MessageRecord cached : entry.messages) {
                if (cached.getId().equals(messageId)) {
                    cached.setSequenceNumber(sequenceNumber);
                    return;
                }
            }
        }
    }

    /**
     * Drops a cached message that turned out to duplicate a durable one.
     */
    public void discard(String conversationId, String messageId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            entry.messages.removeIf(m -> m.getId().equals(messageId));
        }
    }

    public void updateDeliveryStatus(String conversationId, String messageId, DeliveryStatus status,
            Map<String, Object> metadata) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            for (MessageRecord cached : entry.messages) {
                if (cached.getId().equals(messageId)) {
                    cached.setDeliveryStatus(status);
                    if (metadata != null) {
                        cached.getMetadata().putAll(metadata);
                    }
                    return;
                }
            }
        }
    }

    public List<MessageRecord> messages(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            if (entry.evicted) {
                return List.of();
            }
            return entry.messages.stream().map(MessageRecord::copy).toList();
        }
    }

    public Optional<ConversationSummary> summary(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.ofNullable(entry.summary);
        }
    }

    /**
     * Stores a summary if it covers more turns than the cached one.
     */
    public boolean putSummary(String conversationId, ConversationSummary summary) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.summary != null
                    && entry.summary.getCoveredThroughSequenceNumber() >= summary.getCoveredThroughSequenceNumber()) {
                return false;
            }
            entry.summary = summary;
            return true;
        }
    }

    /**
     * Moves a cached conversation onto the canonical conversation that
     * superseded it. Cached messages follow and lose their sequence number, so
     * the next flush writes them under the canonical id; the durable tier
     * ignores ids it already holds.
     */
    public void rekey(String supersededId, ConversationRecord canonical) {
        CachedConversation old = entries.get(supersededId);
        List<MessageRecord> moved = new ArrayList<>();
        ConversationRecord oldRecord = null;
        if (old != null) {
            synchronized (old) {
                old.evicted = true;
                for (MessageRecord message : old.messages) {
                    MessageRecord copy = message.copy();
                    copy.setConversationId(canonical.getId());
                    copy.setSequenceNumber(0);
                    moved.add(copy);
                }
                oldRecord = old.record.copy();
            }
            entries.remove(supersededId, old);
        }

        // the superseded summary is dropped: its sequence numbers no longer apply
        while (true) {
            CachedConversation target = entries.computeIfAbsent(canonical.getId(),
                    id -> new CachedConversation(canonical.copy(), false));
            synchronized (target) {
                if (target.evicted) {
                    continue;
                }
                for (MessageRecord message : moved) {
                    boolean present = target.messages.stream().anyMatch(m -> m.getId().equals(message.getId()));
                    if (!present) {
                        target.messages.add(message);
                    }
                }
                target.messages.sort(Comparator.comparing(MessageRecord::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())));
                if (oldRecord != null) {
                    ConversationMerging.mergeInto(target.record, oldRecord);
                }
            }
            break;
        }
        identityIndex.put(canonical.identityKey(), canonical.getId());
        log.debug("[Memory] re-keyed conversation {} -> {} ({} cached messages)", supersededId, canonical.getId(),
                moved.size());
    }

    /**
     * Evicts an entry unless it is dirty. Never touches the durable tier.
     */
    public boolean evict(String conversationId) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return false;
        }
        IdentityKey key;
        synchronized (entry) {
            if (entry.isDirty()) {
                return false;
            }
            entry.evicted = true;
            key = entry.record.identityKey();
        }
        entries.remove(conversationId, entry);
        identityIndex.remove(key, conversationId);
        return true;
    }

    /**
     * Keeps only the newest {@code maxMessages} cached messages. Unflushed
     * messages are always kept.
     *
     * @return number of messages dropped from the cache
     */
    public int trim(String conversationId, int maxMessages) {
        CachedConversation entry = entries.get(conversationId);
        if (entry == null) {
            return 0;
        }
        synchronized (entry) {
            int excess = entry.messages.size() - maxMessages;
            if (excess <= 0) {
                return 0;
            }
            List<MessageRecord> kept = new ArrayList<>();
            int dropped = 0;
            for (MessageRecord message : entry.messages) {
                if (dropped < excess && message.isDurable()) {
                    dropped++;
                } else {
                    kept.add(message);
                }
            }
            entry.messages.clear();
            entry.messages.addAll(kept);
            return dropped;
        }
    }

    public List<EntrySnapshot> snapshot() {
        List<EntrySnapshot> result = new ArrayList<>();
        for (Map.Entry<String, CachedConversation> e : entries.entrySet()) {
            CachedConversation entry = e.getValue();
            synchronized (entry) {
                if (!entry.evicted) {
                    result.add(new EntrySnapshot(e.getKey(), entry.lastActivityAt(), entry.isDirty(),
                            entry.messages.size()));
                }
            }
        }
        return result;
    }

    public List<ConversationRecord> forOwner(String ownerId) {
        List<ConversationRecord> result = new ArrayList<>();
        for (CachedConversation entry : entries.values()) {
            synchronized (entry) {
                if (!entry.evicted && ownerId.equals(entry.record.getOwnerId())) {
                    result.add(entry.record.copy());
                }
            }
        }
        return result;
    }

    /**
     * Conversations that still hold provisional records or unflushed
     * messages.
     */
    public List<String> dirtyConversationIds() {
        return snapshot().stream()
                .filter(EntrySnapshot::dirty)
                .map(EntrySnapshot::conversationId)
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public int messageCount() {
        int total = 0;
        for (CachedConversation entry : entries.values()) {
            synchronized (entry) {
                total += entry.messages.size();
            }
        }
        return total;
    }

    /**
     * Messages are applied in arrival order, so the preview always follows the
     * latest one; {@code lastMessageAt} never moves backwards.
     */
    static void applyMessageToRecord(ConversationRecord record, MessageRecord message) {
        Instant at = message.getCreatedAt();
        record.setLastMessageText(MessagePreview.of(message));
        if (record.getLastMessageAt() == null || (at != null && at.isAfter(record.getLastMessageAt()))) {
            record.setLastMessageAt(at);
        }
        if (message.getRole() != null && message.getRole().isInbound()) {
            record.setUnreadCount(record.getUnreadCount() + 1);
            record.setUnreadUpdatedAt(at);
            record.setOnline(true);
            record.setPresenceUpdatedAt(at);
        }
    }

    private static final class CachedConversation {

        private final ConversationRecord record;
        private final List<MessageRecord> messages = new ArrayList<>();
        private ConversationSummary summary;
        private boolean provisional;
        private boolean evicted;

        private CachedConversation(ConversationRecord record, boolean provisional) {
            this.record = record;
            this.provisional = provisional;
        }

        private boolean isDirty() {
            return provisional || messages.stream().anyMatch(m -> !m.isDurable());
        }

        private Instant lastActivityAt() {
            if (record.getLastMessageAt() != null) {
                return record.getLastMessageAt();
            }
            return record.getCreatedAt() != null ? record.getCreatedAt() : Instant.EPOCH;
        }
    }
}
