package me.golemcore.converse.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.exception.DurablePersistenceException;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.ConversationRepositoryPort;
import me.golemcore.converse.port.outbound.StoragePort;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Durable tier backed by JSON documents in {@link StoragePort}.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code conversations/<owner>/<conversationId>.json}</li>
 * <li>{@code messages/<conversationId>.json} - the whole message log with the
 * next sequence number</li>
 * <li>{@code summaries/<conversationId>.json}</li>
 * </ul>
 *
 * <p>
 * Every document is replaced atomically. Read-modify-write cycles are
 * serialized per conversation and per owner/address pair within this process.
 * Every storage call is bounded by {@code converse.persistence.timeout}.
 */
@Repository
@Slf4j
public class StorageConversationRepository implements ConversationRepositoryPort {

    private static final String JSON_SUFFIX = ".json";
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private static final Comparator<ConversationRecord> OLDEST_FIRST = Comparator
            .comparing(ConversationRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ConversationRecord::getId);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ConverseProperties properties;

    private final Map<String, Object> conversationLocks = new ConcurrentHashMap<>();
    private final Map<String, Object> identityLocks = new ConcurrentHashMap<>();
    private final Map<String, String> ownerByConversation = new ConcurrentHashMap<>();

    public StorageConversationRepository(StoragePort storagePort, ObjectMapper objectMapper,
            ConverseProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // ==================== conversations ====================

    @Override
    public Optional<ConversationRecord> findById(String conversationId) {
        String ownerId = ownerByConversation.get(conversationId);
        if (ownerId != null) {
            ConversationRecord record = read(conversationsDir(), conversationPath(ownerId, conversationId),
                    ConversationRecord.class);
            if (record != null) {
                return Optional.of(record);
            }
            ownerByConversation.remove(conversationId, ownerId);
        }
        // written by another node or before a restart
        String suffix = "/" + conversationId + JSON_SUFFIX;
        for (String path : listConversationPaths(null)) {
            if (path.endsWith(suffix)) {
                return Optional.ofNullable(indexed(read(conversationsDir(), path, ConversationRecord.class)));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<ConversationRecord> findByOwnerAndAddress(String ownerId, String normalizedAddress) {
        return findByOwner(ownerId).stream()
                .filter(record -> Objects.equals(normalizedAddress, record.getNormalizedAddress()))
                .min(OLDEST_FIRST);
    }

    @Override
    public List<ConversationRecord> findByOwner(String ownerId) {
        List<ConversationRecord> records = new ArrayList<>();
        for (String path : listConversationPaths(ownerKey(ownerId))) {
            ConversationRecord record = read(conversationsDir(), path, ConversationRecord.class);
            if (record != null && Objects.equals(ownerId, record.getOwnerId())) {
                records.add(indexed(record));
            }
        }
        return records;
    }

    @Override
    public List<String> findOwnerIds() {
        Set<String> owners = new LinkedHashSet<>();
        for (String path : listConversationPaths(null)) {
            ConversationRecord record = read(conversationsDir(), path, ConversationRecord.class);
            if (record != null && record.getOwnerId() != null) {
                owners.add(record.getOwnerId());
            }
        }
        return new ArrayList<>(owners);
    }

    @Override
    public ConversationRecord createIfAbsent(ConversationRecord candidate) {
        String identity = candidate.getOwnerId() + "|" + candidate.getNormalizedAddress();
        synchronized (identityLocks.computeIfAbsent(identity, k -> new Object())) {
            Optional<ConversationRecord> existing = findByOwnerAndAddress(candidate.getOwnerId(),
                    candidate.getNormalizedAddress());
            if (existing.isPresent()) {
                return existing.get();
            }
            save(candidate);
            return candidate;
        }
    }

    @Override
    public void save(ConversationRecord conversation) {
        requireSafeId(conversation.getId());
        write(conversationsDir(), conversationPath(conversation.getOwnerId(), conversation.getId()), conversation);
        indexed(conversation);
    }

    @Override
    public void delete(String conversationId) {
        requireSafeId(conversationId);
        synchronized (conversationLock(conversationId)) {
            String suffix = "/" + conversationId + JSON_SUFFIX;
            for (String path : listConversationPaths(null)) {
                if (path.endsWith(suffix)) {
                    await(storagePort.deleteObject(conversationsDir(), path), "delete " + path);
                }
            }
            await(storagePort.deleteObject(messagesDir(), messagesPath(conversationId)), "delete messages");
            await(storagePort.deleteObject(summariesDir(), summaryPath(conversationId)), "delete summary");
            ownerByConversation.remove(conversationId);
        }
    }

    // ==================== messages ====================

    @Override
    public List<MessageRecord> findMessages(String conversationId) {
        requireSafeId(conversationId);
        return readLog(conversationId).getMessages();
    }

    @Override
    public Optional<MessageRecord> insertMessageIfAbsent(MessageRecord message) {
        String conversationId = message.getConversationId();
        requireSafeId(conversationId);
        synchronized (conversationLock(conversationId)) {
            MessageLog messageLog = readLog(conversationId);
            boolean present = messageLog.getMessages().stream()
                    .anyMatch(existing -> Objects.equals(existing.getId(), message.getId()));
            if (present) {
                return Optional.empty();
            }
            MessageRecord stored = message.copy();
            stored.setSequenceNumber(messageLog.getNextSequence());
            messageLog.getMessages().add(stored);
            messageLog.setNextSequence(messageLog.getNextSequence() + 1);
            writeLog(conversationId, messageLog);
            return Optional.of(stored.copy());
        }
    }

    @Override
    public boolean updateDeliveryStatus(String conversationId, String messageId, DeliveryStatus status,
            Map<String, Object> metadata) {
        requireSafeId(conversationId);
        synchronized (conversationLock(conversationId)) {
            MessageLog messageLog = readLog(conversationId);
            for (MessageRecord message : messageLog.getMessages()) {
                if (Objects.equals(message.getId(), messageId)) {
                    message.setDeliveryStatus(status);
                    if (metadata != null) {
                        message.getMetadata().putAll(metadata);
                    }
                    writeLog(conversationId, messageLog);
                    return true;
                }
            }
            return false;
        }
    }

    @Override
    public int reparentMessages(String fromConversationId, String toConversationId) {
        requireSafeId(fromConversationId);
        requireSafeId(toConversationId);
        if (fromConversationId.equals(toConversationId)) {
            return 0;
        }
        String first = fromConversationId.compareTo(toConversationId) < 0 ? fromConversationId : toConversationId;
        String second = first.equals(fromConversationId) ? toConversationId : fromConversationId;
        synchronized (conversationLock(first)) {
            synchronized (conversationLock(second)) {
                MessageLog source = readLog(fromConversationId);
                if (source.getMessages().isEmpty()) {
                    return 0;
                }
                MessageLog target = readLog(toConversationId);
                Set<String> targetIds = new HashSet<>();
                target.getMessages().forEach(message -> targetIds.add(message.getId()));

                List<MessageRecord> merged = new ArrayList<>(target.getMessages());
                int moved = 0;
                for (MessageRecord message : source.getMessages()) {
                    if (targetIds.add(message.getId())) {
                        MessageRecord copy = message.copy();
                        copy.setConversationId(toConversationId);
                        merged.add(copy);
                        moved++;
                    }
                }
                merged.sort(Comparator
                        .comparing(MessageRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparingLong(MessageRecord::getSequenceNumber));
                long sequence = 1;
                for (MessageRecord message : merged) {
                    message.setSequenceNumber(sequence++);
                }

                writeLog(toConversationId, new MessageLog(toConversationId, sequence, merged));
                await(storagePort.deleteObject(messagesDir(), messagesPath(fromConversationId)),
                        "delete merged messages");
                log.info("[Reconcile] Moved {} message(s) from {} to {}", moved, fromConversationId,
                        toConversationId);
                return moved;
            }
        }
    }

    // ==================== summaries ====================

    @Override
    public Optional<ConversationSummary> findSummary(String conversationId) {
        requireSafeId(conversationId);
        return Optional.ofNullable(read(summariesDir(), summaryPath(conversationId), ConversationSummary.class));
    }

    @Override
    public void saveSummary(ConversationSummary summary) {
        requireSafeId(summary.getConversationId());
        write(summariesDir(), summaryPath(summary.getConversationId()), summary);
    }

    // ==================== documents ====================

    private MessageLog readLog(String conversationId) {
        MessageLog messageLog = read(messagesDir(), messagesPath(conversationId), MessageLog.class);
        if (messageLog == null) {
            return new MessageLog(conversationId, 1, new ArrayList<>());
        }
        if (messageLog.getMessages() == null) {
            messageLog.setMessages(new ArrayList<>());
        }
        messageLog.getMessages().sort(Comparator.comparingLong(MessageRecord::getSequenceNumber));
        long highest = messageLog.getMessages().isEmpty() ? 0
                : messageLog.getMessages().get(messageLog.getMessages().size() - 1).getSequenceNumber();
        messageLog.setNextSequence(Math.max(messageLog.getNextSequence(), highest + 1));
        return messageLog;
    }

    private void writeLog(String conversationId, MessageLog messageLog) {
        write(messagesDir(), messagesPath(conversationId), messageLog);
    }

    private <T> T read(String directory, String path, Class<T> type) {
        String json = await(storagePort.getText(directory, path), "read " + directory + "/" + path);
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DurablePersistenceException("Corrupt document " + directory + "/" + path, e);
        }
    }

    private void write(String directory, String path, Object document) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new DurablePersistenceException("Cannot serialize " + directory + "/" + path, e);
        }
        await(storagePort.putTextAtomic(directory, path, json, false), "write " + directory + "/" + path);
    }

    private List<String> listConversationPaths(String ownerKey) {
        List<String> paths = await(storagePort.listObjects(conversationsDir(), ownerKey),
                "list " + conversationsDir());
        return paths.stream().filter(path -> path.endsWith(JSON_SUFFIX)).toList();
    }

    private ConversationRecord indexed(ConversationRecord record) {
        if (record != null && record.getId() != null && record.getOwnerId() != null) {
            ownerByConversation.put(record.getId(), record.getOwnerId());
        }
        return record;
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        long timeoutMs = properties.getPersistence().getTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DurablePersistenceException("Interrupted during " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DurablePersistenceException("Failed to " + operation + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DurablePersistenceException("Timed out after " + timeoutMs + "ms during " + operation, e);
        }
    }

    private Object conversationLock(String conversationId) {
        return conversationLocks.computeIfAbsent(conversationId, k -> new Object());
    }

    private static void requireSafeId(String id) {
        if (id == null || id.isBlank() || UNSAFE_CHARS.matcher(id).find()) {
            throw new IllegalArgumentException("Invalid conversation id: " + id);
        }
    }

    static String ownerKey(String ownerId) {
        return UNSAFE_CHARS.matcher(Objects.requireNonNull(ownerId, "ownerId")).replaceAll("_");
    }

    private static String conversationPath(String ownerId, String conversationId) {
        return ownerKey(ownerId) + "/" + conversationId + JSON_SUFFIX;
    }

    private static String messagesPath(String conversationId) {
        return conversationId + JSON_SUFFIX;
    }

    private static String summaryPath(String conversationId) {
        return conversationId + JSON_SUFFIX;
    }

    private String conversationsDir() {
        return properties.getStorage().getConversationsDirectory();
    }

    private String messagesDir() {
        return properties.getStorage().getMessagesDirectory();
    }

    private String summariesDir() {
        return properties.getStorage().getSummariesDirectory();
    }

    /**
     * Stored form of a conversation's messages.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class MessageLog {
        private String conversationId;
        private long nextSequence = 1;
        private List<MessageRecord> messages = new ArrayList<>();
    }
}
