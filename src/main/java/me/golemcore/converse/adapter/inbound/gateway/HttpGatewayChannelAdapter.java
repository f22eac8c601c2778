package me.golemcore.converse.adapter.inbound.gateway;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.exception.DispatchFailedException;
import me.golemcore.converse.domain.loop.ConversationPipeline;
import me.golemcore.converse.domain.model.DeliveryAck;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.MediaDescriptor;
import me.golemcore.converse.domain.model.MediaKind;
import me.golemcore.converse.domain.model.ReplyContext;
import me.golemcore.converse.domain.service.ChannelAddressNormalizer;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.infrastructure.event.SpringEventBus;
import me.golemcore.converse.port.inbound.ChannelPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Channel adapter for an HTTP messaging gateway (one gateway session per
 * connected phone number).
 *
 * <p>
 * Outbound:
 * <ul>
 * <li>{@code POST <gateway>/sessions/<session>/messages} with
 * {@code {"to", "type", "text"}} or a media payload, answering
 * {@code {"id": "..."}}</li>
 * <li>{@code GET <gateway>/sessions/<session>/media?ref=<reference>} for media
 * bytes</li>
 * </ul>
 *
 * <p>
 * Inbound events are pushed by the gateway and handed to
 * {@link #acceptGatewayEvent}, which converts them into
 * {@link InboundMessage}s and publishes
 * {@link ConversationPipeline.InboundMessageEvent}.
 */
@Component
@Slf4j
public class HttpGatewayChannelAdapter implements ChannelPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DEFAULT_SESSION = "default";

    private final ConverseProperties properties;
    private final ObjectMapper objectMapper;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final OkHttpClient sendClient;
    private final OkHttpClient downloadClient;

    private volatile Consumer<InboundMessage> messageHandler;

    public HttpGatewayChannelAdapter(ConverseProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, SpringEventBus eventBus, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.clock = clock;
        long sendTimeoutMs = properties.getChannel().getSendTimeout().toMillis();
        long downloadTimeoutMs = properties.getChannel().getDownloadTimeout().toMillis();
        this.sendClient = baseHttpClient.newBuilder()
                .callTimeout(sendTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.downloadClient = baseHttpClient.newBuilder()
                .callTimeout(downloadTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(downloadTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public String getChannelType() {
        return properties.getChannel().getType();
    }

    @Override
    public void onMessage(Consumer<InboundMessage> handler) {
        this.messageHandler = handler;
    }

    @Override
    public CompletableFuture<DeliveryAck> sendText(String channelSessionId, String normalizedAddress, String text) {
        OutboundPayload payload = new OutboundPayload(
                ChannelAddressNormalizer.toChannelAddress(normalizedAddress), "text", text,
                null, null, null, null);
        return CompletableFuture.supplyAsync(() -> post(channelSessionId, payload));
    }

    @Override
    public CompletableFuture<DeliveryAck> sendMedia(String channelSessionId, String normalizedAddress,
            MediaDescriptor media) {
        OutboundPayload payload = new OutboundPayload(
                ChannelAddressNormalizer.toChannelAddress(normalizedAddress),
                media.getKind().name().toLowerCase(Locale.ROOT), null,
                media.getReference(), media.getMimeType(), media.getFilename(), media.getCaption());
        return CompletableFuture.supplyAsync(() -> post(channelSessionId, payload));
    }

    @Override
    public CompletableFuture<byte[]> downloadMedia(String channelSessionId, String reference) {
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = sessionUrl(channelSessionId).newBuilder()
                    .addPathSegment("media")
                    .addQueryParameter("ref", reference)
                    .build();
            try (Response response = downloadClient.newCall(authorized(new Request.Builder().url(url).get()))
                    .execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new DispatchFailedException("Media download failed: HTTP " + response.code());
                }
                return body.bytes();
            } catch (IOException e) {
                throw new DispatchFailedException("Media download failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Converts a gateway event into an inbound message and publishes it. Events
     * echoing our own outbound messages are ignored.
     *
     * @return the published message, or {@code null} if the event was ignored
     */
    public InboundMessage acceptGatewayEvent(String ownerId, String channelSessionId, String eventJson)
            throws IOException {
        GatewayEvent event = objectMapper.readValue(eventJson, GatewayEvent.class);
        if (event.fromMe() || event.id() == null || event.from() == null) {
            log.debug("[Gateway] Ignoring event {} (own or incomplete)", event.id());
            return null;
        }
        InboundMessage message = InboundMessage.builder()
                .messageId(event.id())
                .ownerId(ownerId)
                .channelSessionId(channelSessionId)
                .rawAddress(event.from())
                .senderName(event.pushName())
                .content(event.text())
                .media(toMedia(event.media()))
                .replyContext(toReplyContext(event.quoted()))
                .timestamp(event.timestamp() != null ? Instant.ofEpochSecond(event.timestamp())
                        : clock.instant())
                .build();
        accept(message);
        return message;
    }

    /**
     * Hands an inbound message to the registered handler and the pipeline.
     */
    public void accept(InboundMessage message) {
        Consumer<InboundMessage> handler = this.messageHandler;
        if (handler != null) {
            handler.accept(message);
        }
        eventBus.publish(new ConversationPipeline.InboundMessageEvent(message, clock.instant()));
    }

    private DeliveryAck post(String channelSessionId, OutboundPayload payload) {
        HttpUrl url = sessionUrl(channelSessionId).newBuilder().addPathSegment("messages").build();
        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = authorized(new Request.Builder().url(url).post(RequestBody.create(json, JSON)));
            try (Response response = sendClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    throw new DispatchFailedException("Gateway rejected message: HTTP " + response.code());
                }
                String responseBody = body != null ? body.string() : "";
                String externalId = responseBody.isBlank()
                        ? null
                        : objectMapper.readValue(responseBody, SendResponse.class).id();
                log.debug("[Gateway] Sent {} to {} (id={})", payload.type(), payload.to(), externalId);
                return new DeliveryAck(externalId);
            }
        } catch (IOException e) {
            throw new DispatchFailedException("Gateway send failed: " + e.getMessage(), e);
        }
    }

    private HttpUrl sessionUrl(String channelSessionId) {
        String gatewayUrl = properties.getChannel().getGatewayUrl();
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            throw new DispatchFailedException("Gateway URL is not configured");
        }
        return HttpUrl.get(gatewayUrl).newBuilder()
                .addPathSegment("sessions")
                .addPathSegment(channelSessionId != null && !channelSessionId.isBlank()
                        ? channelSessionId
                        : DEFAULT_SESSION)
                .build();
    }

    private Request authorized(Request.Builder builder) {
        String apiKey = properties.getChannel().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private static MediaDescriptor toMedia(GatewayMedia media) {
        if (media == null || media.type() == null) {
            return null;
        }
        MediaKind kind;
        try {
            kind = MediaKind.valueOf(media.type().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("[Gateway] Unsupported media type: {}", media.type());
            return null;
        }
        return MediaDescriptor.builder()
                .kind(kind)
                .reference(media.url())
                .mimeType(media.mimeType())
                .filename(media.filename())
                .caption(media.caption())
                .build();
    }

    private static ReplyContext toReplyContext(GatewayQuote quoted) {
        if (quoted == null || quoted.id() == null) {
            return null;
        }
        return ReplyContext.builder()
                .quotedMessageId(quoted.id())
                .quotedText(quoted.text())
                .quotedType(quoted.type() != null ? quoted.type() : "text")
                .build();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record OutboundPayload(String to, String type, String text, String url, String mimeType, String filename,
            String caption) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SendResponse(String id) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GatewayEvent(String id, String from, String pushName, String text, boolean fromMe, Long timestamp,
            GatewayMedia media, GatewayQuote quoted) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GatewayMedia(String type, String url, String mimeType, String filename, String caption) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GatewayQuote(String id, String text, String type) {
    }
}
