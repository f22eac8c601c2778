package me.golemcore.converse.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.service.IdentityRunCoordinator;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Listens for inbound messages and delegates processing to
 * {@link IdentityRunCoordinator}, which keeps {@link ConversationPipeline} free
 * of queueing concerns.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageListener {

    private final IdentityRunCoordinator coordinator;

    @EventListener
    public void onInboundMessage(ConversationPipeline.InboundMessageEvent event) {
        InboundMessage message = event.message();
        log.debug("[Inbound] enqueue message {} (owner={}, from={})", message.getMessageId(), message.getOwnerId(),
                message.getRawAddress());
        coordinator.enqueue(message);
    }
}
