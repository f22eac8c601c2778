package me.golemcore.converse.testsupport;

import me.golemcore.converse.domain.exception.DurablePersistenceException;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.port.outbound.ConversationRepositoryPort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable tier held in memory. {@link #setFailing(boolean)} simulates an
 * outage: every call then fails with {@link DurablePersistenceException}.
 */
public class InMemoryConversationRepository implements ConversationRepositoryPort {

    private final Map<String, ConversationRecord> conversations = new LinkedHashMap<>();
    private final Map<String, List<MessageRecord>> messages = new HashMap<>();
    private final Map<String, Long> nextSequence = new HashMap<>();
    private final Map<String, ConversationSummary> summaries = new HashMap<>();
    private final AtomicInteger messageInserts = new AtomicInteger();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int messageInserts() {
        return messageInserts.get();
    }

    /**
     * Stores a conversation without the one-per-address check, the way two
     * racing writers on separate nodes could.
     */
    public synchronized void insertUnchecked(ConversationRecord record) {
        conversations.put(record.getId(), record.copy());
    }

    /**
     * Appends a message as-is, keeping its sequence number.
     */
    public synchronized void insertMessageUnchecked(MessageRecord message) {
        messages.computeIfAbsent(message.getConversationId(), k -> new ArrayList<>()).add(message.copy());
        nextSequence.merge(message.getConversationId(), message.getSequenceNumber() + 1, Math::max);
    }

    public synchronized int conversationCount() {
        return conversations.size();
    }

    @Override
    public synchronized Optional<ConversationRecord> findById(String conversationId) {
        check();
        return Optional.ofNullable(conversations.get(conversationId)).map(ConversationRecord::copy);
    }

    @Override
    public synchronized Optional<ConversationRecord> findByOwnerAndAddress(String ownerId, String normalizedAddress) {
        check();
        return conversations.values().stream()
                .filter(c -> c.getOwnerId().equals(ownerId) && c.getNormalizedAddress().equals(normalizedAddress))
                .min(Comparator.comparing(ConversationRecord::getCreatedAt))
                .map(ConversationRecord::copy);
    }

    @Override
    public synchronized List<ConversationRecord> findByOwner(String ownerId) {
        check();
        return conversations.values().stream()
                .filter(c -> c.getOwnerId().equals(ownerId))
                .map(ConversationRecord::copy)
                .toList();
    }

    @Override
    public synchronized List<String> findOwnerIds() {
        check();
        return conversations.values().stream().map(ConversationRecord::getOwnerId).distinct().sorted().toList();
    }

    @Override
    public synchronized ConversationRecord createIfAbsent(ConversationRecord candidate) {
        Optional<ConversationRecord> existing = findByOwnerAndAddress(candidate.getOwnerId(),
                candidate.getNormalizedAddress());
        if (existing.isPresent()) {
            return existing.get();
        }
        conversations.put(candidate.getId(), candidate.copy());
        return candidate.copy();
    }

    @Override
    public synchronized void save(ConversationRecord conversation) {
        check();
        conversations.put(conversation.getId(), conversation.copy());
    }

    @Override
    public synchronized void delete(String conversationId) {
        check();
        conversations.remove(conversationId);
        messages.remove(conversationId);
        summaries.remove(conversationId);
    }

    @Override
    public synchronized List<MessageRecord> findMessages(String conversationId) {
        check();
        return messages.getOrDefault(conversationId, List.of()).stream()
                .sorted(Comparator.comparingLong(MessageRecord::getSequenceNumber))
                .map(MessageRecord::copy)
                .toList();
    }

    @Override
    public synchronized Optional<MessageRecord> insertMessageIfAbsent(MessageRecord message) {
        check();
        List<MessageRecord> log = messages.computeIfAbsent(message.getConversationId(), k -> new ArrayList<>());
        if (log.stream().anyMatch(m -> m.getId().equals(message.getId()))) {
            return Optional.empty();
        }
        long sequence = nextSequence.getOrDefault(message.getConversationId(), 1L);
        nextSequence.put(message.getConversationId(), sequence + 1);
        MessageRecord stored = message.copy();
        stored.setSequenceNumber(sequence);
        log.add(stored);
        messageInserts.incrementAndGet();
        return Optional.of(stored.copy());
    }

    @Override
    public synchronized boolean updateDeliveryStatus(String conversationId, String messageId, DeliveryStatus status,
            Map<String, Object> metadata) {
        check();
        for (MessageRecord message : messages.getOrDefault(conversationId, List.of())) {
            if (message.getId().equals(messageId)) {
                message.setDeliveryStatus(status);
                if (metadata != null) {
                    message.getMetadata().putAll(metadata);
                }
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized int reparentMessages(String fromConversationId, String toConversationId) {
        check();
        List<MessageRecord> source = messages.getOrDefault(fromConversationId, List.of());
        List<MessageRecord> target = messages.computeIfAbsent(toConversationId, k -> new ArrayList<>());
        int moved = 0;
        for (MessageRecord message : source) {
            if (target.stream().noneMatch(m -> m.getId().equals(message.getId()))) {
                MessageRecord copy = message.copy();
                copy.setConversationId(toConversationId);
                target.add(copy);
                moved++;
            }
        }
        target.sort(Comparator.comparing(MessageRecord::getCreatedAt,
                Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingLong(MessageRecord::getSequenceNumber));
        long sequence = 1;
        for (MessageRecord message : target) {
            message.setSequenceNumber(sequence++);
        }
        nextSequence.put(toConversationId, sequence);
        messages.remove(fromConversationId);
        return moved;
    }

    @Override
    public synchronized Optional<ConversationSummary> findSummary(String conversationId) {
        check();
        return Optional.ofNullable(summaries.get(conversationId));
    }

    @Override
    public synchronized void saveSummary(ConversationSummary summary) {
        check();
        summaries.put(summary.getConversationId(), summary);
    }

    private void check() {
        if (failing) {
            throw new DurablePersistenceException("durable tier unavailable", null);
        }
    }
}
