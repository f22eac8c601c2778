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
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.MemoryStats;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.ReconciliationReport;
import me.golemcore.converse.port.inbound.ConversationQueryPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Operator-facing view of the conversations: listing, reading, manual replies
 * and maintenance.
 */
@Service
@Slf4j
public class ConversationOperatorService implements ConversationQueryPort {

    private final ConversationStore store;
    private final ResponseDispatcher dispatcher;
    private final MemoryLifecycleManager lifecycleManager;
    private final ConversationReconciliationService reconciliationService;

    public ConversationOperatorService(ConversationStore store, ResponseDispatcher dispatcher,
            MemoryLifecycleManager lifecycleManager, ConversationReconciliationService reconciliationService) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.lifecycleManager = lifecycleManager;
        this.reconciliationService = reconciliationService;
    }

    @Override
    public List<ConversationRecord> listConversations(String ownerId, String channelSessionId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        return store.listForOwner(ownerId, channelSessionId);
    }

    @Override
    public List<MessageRecord> listMessages(String conversationId) {
        ConversationRecord conversation = store.require(conversationId);
        return store.listMessages(conversation.getId());
    }

    @Override
    public MessageRecord sendOperatorMessage(String conversationId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text is required");
        }
        ConversationRecord conversation = store.require(conversationId);
        MessageRecord sent = dispatcher.dispatchOperatorMessage(conversation, text.trim());
        log.info("[Dispatch] Operator message {} to conversation {}: {}", sent.getId(), conversation.getId(),
                sent.getDeliveryStatus());
        return sent;
    }

    @Override
    public ConversationRecord markRead(String conversationId) {
        return store.markRead(conversationId);
    }

    @Override
    public MemoryStats getMemoryStats() {
        return lifecycleManager.stats();
    }

    @Override
    public ReconciliationReport reconcileDuplicates(String ownerId) {
        return ownerId == null ? reconciliationService.reconcileAll() : reconciliationService.reconcileOwner(ownerId);
    }
}
