package me.golemcore.converse.port.outbound;

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

import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable tier for conversations, messages and summaries.
 *
 * <p>
 * Calls are synchronous and bounded by the implementation's own timeout.
 * Failures surface as
 * {@link me.golemcore.converse.domain.exception.DurablePersistenceException}.
 */
public interface ConversationRepositoryPort {

    Optional<ConversationRecord> findById(String conversationId);

    /**
     * Find the conversation for an owner and normalized address. When
     * duplicates exist, the oldest-created one is returned.
     */
    Optional<ConversationRecord> findByOwnerAndAddress(String ownerId, String normalizedAddress);

    List<ConversationRecord> findByOwner(String ownerId);

    List<String> findOwnerIds();

    /**
     * Insert {@code candidate} unless a conversation for the same owner and
     * address already exists.
     *
     * @return the stored conversation, either {@code candidate} or the existing
     *         one
     */
    ConversationRecord createIfAbsent(ConversationRecord candidate);

    void save(ConversationRecord conversation);

    void delete(String conversationId);

    /**
     * Messages of a conversation ordered by sequence number.
     */
    List<MessageRecord> findMessages(String conversationId);

    /**
     * Insert a message unless one with the same id already exists in the
     * conversation. The repository assigns the next sequence number.
     *
     * @return the stored message with its sequence number, or empty if the id
     *         was already present
     */
    Optional<MessageRecord> insertMessageIfAbsent(MessageRecord message);

    boolean updateDeliveryStatus(String conversationId, String messageId, DeliveryStatus status,
            Map<String, Object> metadata);

    /**
     * Move every message of {@code fromConversationId} onto
     * {@code toConversationId}. The merged history is ordered by creation time
     * and renumbered so that sequence numbers stay strictly increasing.
     *
     * @return number of messages moved
     */
    int reparentMessages(String fromConversationId, String toConversationId);

    Optional<ConversationSummary> findSummary(String conversationId);

    void saveSummary(ConversationSummary summary);
}
