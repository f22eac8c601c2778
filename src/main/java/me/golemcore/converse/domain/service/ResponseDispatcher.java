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
import me.golemcore.converse.domain.exception.DispatchFailedException;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.DeliveryAck;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.inbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sends outbound turns through the channel and records them.
 *
 * <p>
 * Every outbound turn is appended to the conversation whatever the outcome of
 * the send: {@code SENT} with the channel's message id, or {@code FAILED} with
 * the error in its metadata.
 */
@Service
@Slf4j
public class ResponseDispatcher {

    private final Map<String, ChannelPort> channels;
    private final ConversationStore store;
    private final ReplyFormatter replyFormatter;
    private final ConverseProperties properties;
    private final Clock clock;

    public ResponseDispatcher(List<ChannelPort> channelPorts, ConversationStore store, ReplyFormatter replyFormatter,
            ConverseProperties properties, Clock clock) {
        this.channels = channelPorts.stream()
                .collect(Collectors.toMap(ChannelPort::getChannelType, Function.identity(), (a, b) -> a));
        this.store = store;
        this.replyFormatter = replyFormatter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Sends a generated reply after stripping markdown.
     */
    public MessageRecord dispatchReply(ConversationRecord conversation, String generatedText) {
        return dispatch(conversation, replyFormatter.format(generatedText), MessageRole.AUTOMATED_AGENT);
    }

    /**
     * Sends a fixed notice, such as the quota or apology message, verbatim.
     */
    public MessageRecord dispatchNotice(ConversationRecord conversation, String text) {
        return dispatch(conversation, text, MessageRole.AUTOMATED_AGENT);
    }

    public MessageRecord dispatchOperatorMessage(ConversationRecord conversation, String text) {
        return dispatch(conversation, text, MessageRole.OPERATOR);
    }

    MessageRecord dispatch(ConversationRecord conversation, String text, MessageRole role) {
        MessageRecord message = MessageRecord.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversation.getId())
                .content(text)
                .role(role)
                .createdAt(clock.instant())
                .build();

        try {
            DeliveryAck ack = send(conversation, text);
            message.setDeliveryStatus(DeliveryStatus.SENT);
            if (ack != null && ack.externalMessageId() != null) {
                message.getMetadata().put(MessageRecord.META_EXTERNAL_ID, ack.externalMessageId());
            }
            log.debug("[Dispatch] Sent {} message to {}", role, conversation.getNormalizedAddress());
        } catch (DispatchFailedException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put(MessageRecord.META_ERROR, e.getMessage());
            error.put(MessageRecord.META_ERROR_AT, clock.instant().toString());
            message.setDeliveryStatus(DeliveryStatus.FAILED);
            message.getMetadata().putAll(error);
            log.warn("[Dispatch] Failed to send to {}: {}", conversation.getNormalizedAddress(), e.getMessage());
        }

        store.appendMessage(conversation.getId(), message).whenComplete((persisted, failure) -> {
            if (failure != null) {
                log.warn("[Dispatch] Outbound message {} kept in memory only: {}", message.getId(),
                        failure.getMessage());
            }
        });
        return message;
    }

    private DeliveryAck send(ConversationRecord conversation, String text) {
        ChannelPort channel = channels.get(properties.getChannel().getType());
        if (channel == null) {
            throw new DispatchFailedException("No channel registered for type " + properties.getChannel().getType());
        }
        if (text == null || text.isBlank()) {
            throw new DispatchFailedException("Refusing to send an empty message");
        }
        CompletableFuture<DeliveryAck> future = null;
        try {
            future = channel.sendText(conversation.getLinkedChannelSessionId(), conversation.getNormalizedAddress(),
                    text);
            return future.get(properties.getChannel().getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchFailedException("Send interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DispatchFailedException("Send timed out after " + properties.getChannel().getSendTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DispatchFailedException(cause.getMessage(), cause);
        } catch (DispatchFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DispatchFailedException(e.getMessage(), e);
        }
    }
}
