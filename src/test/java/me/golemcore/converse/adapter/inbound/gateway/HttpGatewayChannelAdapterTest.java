package me.golemcore.converse.adapter.inbound.gateway;

import me.golemcore.converse.domain.exception.DispatchFailedException;
import me.golemcore.converse.domain.loop.ConversationPipeline;
import me.golemcore.converse.domain.model.DeliveryAck;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.MediaDescriptor;
import me.golemcore.converse.domain.model.MediaKind;
import me.golemcore.converse.infrastructure.config.AutoConfiguration;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.infrastructure.event.SpringEventBus;
import me.golemcore.converse.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpGatewayChannelAdapterTest {

    private static final String GATEWAY_URL = "http://mock.gateway.local";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00.250Z");

    private OkHttpMockEngine httpEngine;
    private ConverseProperties properties;
    private SpringEventBus eventBus;
    private HttpGatewayChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new ConverseProperties();
        properties.getChannel().setGatewayUrl(GATEWAY_URL);
        properties.getChannel().setApiKey("gw-key");
        eventBus = mock(SpringEventBus.class);
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(httpEngine)
                .build();
        adapter = new HttpGatewayChannelAdapter(properties, client, AutoConfiguration.objectMapper(), eventBus,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== outbound ====================

    @Test
    void sendTextPostsToSessionAndReturnsMessageId() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"wamid-1\",\"status\":\"queued\"}");

        DeliveryAck ack = adapter.sendText("session-1", "237691234567", "Bonjour").get();

        assertEquals("wamid-1", ack.externalMessageId());
        OkHttpMockEngine.Recorded request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/sessions/session-1/messages", request.path());
        assertEquals("Bearer gw-key", request.header("Authorization"));
        assertTrue(request.body().contains("\"to\":\"237691234567@s.whatsapp.net\""));
        assertTrue(request.body().contains("\"type\":\"text\""));
        assertTrue(request.body().contains("\"text\":\"Bonjour\""));
        assertFalse(request.body().contains("\"url\""));
    }

    @Test
    void missingSessionUsesDefault() throws Exception {
        httpEngine.enqueueJson(200, "");

        DeliveryAck ack = adapter.sendText(null, "237691234567", "Bonjour").get();

        assertNull(ack.externalMessageId());
        assertEquals("/sessions/default/messages", httpEngine.takeRequest().path());
    }

    @Test
    void sendToGroupUsesGroupAddress() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"wamid-2\"}");

        adapter.sendText("session-1", "group:120363012345678901", "Bonjour").get();

        assertTrue(httpEngine.takeRequest().body().contains("\"to\":\"120363012345678901@g.us\""));
    }

    @Test
    void sendMediaCarriesReference() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"wamid-3\"}");
        MediaDescriptor media = MediaDescriptor.builder()
                .kind(MediaKind.DOCUMENT)
                .reference("https://files.example/tarifs.pdf")
                .filename("tarifs.pdf")
                .build();

        adapter.sendMedia("session-1", "237691234567", media).get();

        String body = httpEngine.takeRequest().body();
        assertTrue(body.contains("\"type\":\"document\""));
        assertTrue(body.contains("\"url\":\"https://files.example/tarifs.pdf\""));
        assertTrue(body.contains("\"filename\":\"tarifs.pdf\""));
    }

    @Test
    void rejectedSendFailsWithDispatchError() {
        httpEngine.enqueueJson(502, "{\"error\":\"session closed\"}");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.sendText("session-1", "237691234567", "Bonjour").get());
        assertInstanceOf(DispatchFailedException.class, error.getCause());
    }

    @Test
    void missingGatewayUrlFailsWithDispatchError() {
        properties.getChannel().setGatewayUrl("");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.sendText("session-1", "237691234567", "Bonjour").get());
        assertInstanceOf(DispatchFailedException.class, error.getCause());
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void downloadMediaReturnsBytes() throws Exception {
        byte[] image = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);
        httpEngine.enqueueBytes(200, image, "image/jpeg");

        byte[] downloaded = adapter.downloadMedia("session-1", "media/abc 1").get();

        assertArrayEquals(image, downloaded);
        OkHttpMockEngine.Recorded request = httpEngine.takeRequest();
        assertEquals("/sessions/session-1/media", request.path());
        assertEquals("media/abc 1", request.queryParameter("ref"));
    }

    // ==================== inbound ====================

    @Test
    void gatewayEventIsConvertedAndPublished() throws Exception {
        List<InboundMessage> handled = new ArrayList<>();
        adapter.onMessage(handled::add);
        String event = """
                {"id":"wamid-in-1","from":"237691234567:3@s.whatsapp.net","pushName":"Awa",
                 "text":"Bonjour","fromMe":false,"timestamp":1768471200,
                 "media":{"type":"image","url":"media-1","mimeType":"image/jpeg","caption":"colis"},
                 "quoted":{"id":"wamid-out-9","text":"Le transport prend 45 jours."},
                 "extra":"ignored"}
                """;

        InboundMessage message = adapter.acceptGatewayEvent("owner-1", "session-1", event);

        assertNotNull(message);
        assertEquals("wamid-in-1", message.getMessageId());
        assertEquals("owner-1", message.getOwnerId());
        assertEquals("session-1", message.getChannelSessionId());
        assertEquals("237691234567:3@s.whatsapp.net", message.getRawAddress());
        assertEquals("Awa", message.getSenderName());
        assertEquals(Instant.ofEpochSecond(1768471200L), message.getTimestamp());
        assertEquals(MediaKind.IMAGE, message.getMedia().getKind());
        assertEquals("media-1", message.getMedia().getReference());
        assertEquals("wamid-out-9", message.getReplyContext().getQuotedMessageId());
        assertEquals("text", message.getReplyContext().getQuotedType());
        assertEquals(List.of(message), handled);

        ArgumentCaptor<ConversationPipeline.InboundMessageEvent> published = ArgumentCaptor
                .forClass(ConversationPipeline.InboundMessageEvent.class);
        verify(eventBus).publish(published.capture());
        assertSame(message, published.getValue().message());
        assertEquals(NOW, published.getValue().timestamp());
    }

    @Test
    void missingTimestampFallsBackToClock() throws Exception {
        String event = "{\"id\":\"wamid-in-3\",\"from\":\"237691234567@s.whatsapp.net\",\"text\":\"Allo\"}";

        InboundMessage message = adapter.acceptGatewayEvent("owner-1", "session-1", event);

        assertEquals(NOW, message.getTimestamp());
    }

    @Test
    void quotedImageWithoutCaptionKeepsQuoteReference() throws Exception {
        String event = "{\"id\":\"wamid-in-4\",\"from\":\"237691234567@s.whatsapp.net\",\"text\":\"Combien ?\","
                + "\"quoted\":{\"id\":\"wamid-out-7\",\"type\":\"image\"}}";

        InboundMessage message = adapter.acceptGatewayEvent("owner-1", "session-1", event);

        assertEquals("wamid-out-7", message.getReplyContext().getQuotedMessageId());
        assertEquals("image", message.getReplyContext().getQuotedType());
        assertNull(message.getReplyContext().getQuotedText());
    }

    @Test
    void ownMessagesAreIgnored() throws Exception {
        String event = "{\"id\":\"wamid-out-1\",\"from\":\"237691234567@s.whatsapp.net\",\"fromMe\":true}";

        assertNull(adapter.acceptGatewayEvent("owner-1", "session-1", event));
        verify(eventBus, never()).publish(any());
    }

    @Test
    void unsupportedMediaTypeIsDropped() throws Exception {
        String event = "{\"id\":\"wamid-in-2\",\"from\":\"237691234567@s.whatsapp.net\",\"text\":\"\","
                + "\"media\":{\"type\":\"sticker\",\"url\":\"s-1\"}}";

        InboundMessage message = adapter.acceptGatewayEvent("owner-1", "session-1", event);

        assertNull(message.getMedia());
    }
}
