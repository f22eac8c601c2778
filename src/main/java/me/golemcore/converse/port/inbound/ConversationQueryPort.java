package me.golemcore.converse.port.inbound;

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
import me.golemcore.converse.domain.model.MemoryStats;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.ReconciliationReport;

import java.util.List;

/**
 * Operations offered to CRUD and administrative layers.
 */
public interface ConversationQueryPort {

    /**
     * Conversations of an owner, newest activity first.
     *
     * @param channelSessionId
     *            optional filter, {@code null} for all sessions
     */
    List<ConversationRecord> listConversations(String ownerId, String channelSessionId);

    /**
     * Messages of a conversation in chronological order.
     *
     * @throws me.golemcore.converse.domain.exception.ConversationNotFoundException
     *             if the conversation is unknown
     */
    List<MessageRecord> listMessages(String conversationId);

    /**
     * Sends a message written by a human operator and persists it.
     *
     * @throws me.golemcore.converse.domain.exception.ConversationNotFoundException
     *             if the conversation is unknown
     */
    MessageRecord sendOperatorMessage(String conversationId, String text);

    /**
     * Resets the unread counter.
     *
     * @throws me.golemcore.converse.domain.exception.ConversationNotFoundException
     *             if the conversation is unknown
     */
    ConversationRecord markRead(String conversationId);

    MemoryStats getMemoryStats();

    ReconciliationReport reconcileDuplicates(String ownerId);
}
