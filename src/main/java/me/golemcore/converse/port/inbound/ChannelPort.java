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

import me.golemcore.converse.domain.model.DeliveryAck;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.MediaDescriptor;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Bidirectional port for the person-to-person messaging channel. Receives
 * inbound messages and sends replies. Addresses are passed in normalized form;
 * implementations map them back to the channel's own address format.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "whatsapp").
     */
    String getChannelType();

    /**
     * Registers the handler invoked for every inbound message.
     */
    void onMessage(Consumer<InboundMessage> handler);

    /**
     * Sends a text message. Fails with
     * {@link me.golemcore.converse.domain.exception.DispatchFailedException}.
     */
    CompletableFuture<DeliveryAck> sendText(String channelSessionId, String normalizedAddress, String text);

    /**
     * Sends a media message referenced by {@code media.reference}.
     */
    CompletableFuture<DeliveryAck> sendMedia(String channelSessionId, String normalizedAddress,
            MediaDescriptor media);

    /**
     * Downloads the bytes of an inbound media reference.
     */
    CompletableFuture<byte[]> downloadMedia(String channelSessionId, String reference);
}
