package me.golemcore.converse.domain.loop;

import me.golemcore.converse.domain.exception.GeneratorException;
import me.golemcore.converse.domain.model.DeliveryAck;
import me.golemcore.converse.domain.model.GenerationRequest;
import me.golemcore.converse.domain.model.GenerationResponse;
import me.golemcore.converse.domain.model.GenerationTurn;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.KnowledgeDocument;
import me.golemcore.converse.domain.model.MediaAnalysis;
import me.golemcore.converse.domain.model.MediaDescriptor;
import me.golemcore.converse.domain.model.MediaKind;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.domain.model.PipelineOutcome;
import me.golemcore.converse.domain.model.QuotaCheckResult;
import me.golemcore.converse.domain.service.ContextComposer;
import me.golemcore.converse.domain.service.ConversationMemoryTier;
import me.golemcore.converse.domain.service.ConversationStore;
import me.golemcore.converse.domain.service.ConversationSummarizer;
import me.golemcore.converse.domain.service.KnowledgeRetrievalService;
import me.golemcore.converse.domain.service.LanguageDetector;
import me.golemcore.converse.domain.service.QuotaGate;
import me.golemcore.converse.domain.service.ReplyFormatter;
import me.golemcore.converse.domain.service.ResponseDispatcher;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.inbound.ChannelPort;
import me.golemcore.converse.port.outbound.GeneratorPort;
import me.golemcore.converse.port.outbound.KnowledgeBasePort;
import me.golemcore.converse.port.outbound.MediaAnalysisPort;
import me.golemcore.converse.port.outbound.QuotaPort;
import me.golemcore.converse.testsupport.InMemoryConversationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConversationPipelineTest {

    private static final String OWNER = "owner-1";
    private static final String ADDRESS = "237691234567@s.whatsapp.net";
    private static final String SESSION = "session-1";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String QUESTION = "Bonjour, quel est le prix du transport maritime ?";

    private ExecutorService writeExecutor;
    private ConverseProperties properties;
    private ConversationStore store;
    private QuotaPort quotaPort;
    private KnowledgeBasePort knowledgeBasePort;
    private ConversationSummarizer summarizer;
    private GeneratorPort generatorPort;
    private MediaAnalysisPort mediaAnalysisPort;
    private ChannelPort channel;
    private ConversationPipeline pipeline;

    @BeforeEach
    void setUp() {
        writeExecutor = Executors.newSingleThreadExecutor();
        properties = new ConverseProperties();
        properties.getQuota().setEnabled(true);
        properties.getKnowledge().setDefaultKnowledgeBaseId("kb-main");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        store = new ConversationStore(new InMemoryConversationRepository(), new ConversationMemoryTier(), properties,
                writeExecutor, clock);

        quotaPort = mock(QuotaPort.class);
        when(quotaPort.check(OWNER)).thenReturn(CompletableFuture.completedFuture(QuotaCheckResult.allowed(100, 1)));

        knowledgeBasePort = mock(KnowledgeBasePort.class);
        when(knowledgeBasePort.listDocuments("kb-main")).thenReturn(List.of(KnowledgeDocument.builder()
                .id("tarifs")
                .knowledgeBaseId("kb-main")
                .title("Tarifs transport maritime")
                .content("Le transport maritime vers Douala coute 850 USD/CBM, delai 45 jours.")
                .build()));

        summarizer = mock(ConversationSummarizer.class);
        generatorPort = mock(GeneratorPort.class);
        when(generatorPort.isAvailable()).thenReturn(true);
        mediaAnalysisPort = mock(MediaAnalysisPort.class);

        channel = mock(ChannelPort.class);
        when(channel.getChannelType()).thenReturn("whatsapp");
        when(channel.sendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(new DeliveryAck("wamid-out")));

        ResponseDispatcher dispatcher = new ResponseDispatcher(List.of(channel), store, new ReplyFormatter(),
                properties, clock);
        pipeline = new ConversationPipeline(store, new QuotaGate(quotaPort, properties),
                new KnowledgeRetrievalService(knowledgeBasePort, properties), summarizer,
                new ContextComposer(properties), new LanguageDetector(properties), dispatcher, generatorPort,
                mediaAnalysisPort, List.of(channel), properties, clock);
    }

    @AfterEach
    void tearDown() {
        writeExecutor.shutdownNow();
    }

    private static InboundMessage inbound(String id, String address, String content) {
        return InboundMessage.builder()
                .messageId(id)
                .ownerId(OWNER)
                .channelSessionId(SESSION)
                .rawAddress(address)
                .senderName("Awa")
                .content(content)
                .timestamp(NOW.minusSeconds(30))
                .build();
    }

    private void generatorReplies(String text) {
        when(generatorPort.generate(any())).thenReturn(CompletableFuture.completedFuture(
                GenerationResponse.builder().text(text).model("gpt-4o-mini").build()));
    }

    private List<MessageRecord> historyOf(String address) {
        return store.listMessages(store.findOrCreate(OWNER, address, SESSION).getId());
    }

    // ==================== reply ====================

    @Test
    void groundedReplyIsGeneratedAndSent() {
        generatorReplies("**Prix**: 850 USD/CBM");

        PipelineOutcome outcome = pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION));

        assertEquals(PipelineOutcome.REPLIED, outcome);
        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generatorPort).generate(request.capture());
        assertTrue(request.getValue().getSystemContext().contains("850 USD/CBM"));
        List<GenerationTurn> turns = request.getValue().getTurns();
        assertEquals(QUESTION, turns.get(turns.size() - 1).content());
        assertEquals(GenerationTurn.Speaker.USER, turns.get(turns.size() - 1).speaker());

        verify(channel).sendText(SESSION, "237691234567", "Prix: 850 USD/CBM");
        List<MessageRecord> history = historyOf(ADDRESS);
        assertEquals(2, history.size());
        assertEquals(MessageRole.INBOUND_PARTY, history.get(0).getRole());
        assertEquals(MessageRole.AUTOMATED_AGENT, history.get(1).getRole());
        assertEquals("Prix: 850 USD/CBM", history.get(1).getContent());
    }

    @Test
    void summarizerRunsBeforeComposition() {
        generatorReplies("Bonjour");

        pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION));

        verify(summarizer).summarizeIfDue(anyString());
    }

    // ==================== quota ====================

    @Test
    void quotaDeniedSendsNoticeWithoutGenerating() {
        when(quotaPort.check(OWNER)).thenReturn(CompletableFuture.completedFuture(QuotaCheckResult.denied(100, 100)));
        properties.getQuota().setLimitReachedMessage("Limite atteinte");

        PipelineOutcome outcome = pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION));

        assertEquals(PipelineOutcome.QUOTA_NOTICE, outcome);
        verify(generatorPort, never()).generate(any());
        verify(channel, times(1)).sendText(SESSION, "237691234567", "Limite atteinte");
    }

    // ==================== generation failures ====================

    @Test
    void generatorFailureSendsApology() {
        when(generatorPort.generate(any())).thenReturn(CompletableFuture.failedFuture(
                new GeneratorException(GeneratorException.Kind.ERROR, "HTTP 500")));

        PipelineOutcome outcome = pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION));

        assertEquals(PipelineOutcome.APOLOGY, outcome);
        verify(channel).sendText(SESSION, "237691234567", properties.getPipeline().getApologyMessage());
    }

    @Test
    void unavailableGeneratorSendsApology() {
        when(generatorPort.isAvailable()).thenReturn(false);

        PipelineOutcome outcome = pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION));

        assertEquals(PipelineOutcome.APOLOGY, outcome);
        verify(generatorPort, never()).generate(any());
    }

    @Test
    void blankGeneratedReplySendsApology() {
        generatorReplies("   ");

        assertEquals(PipelineOutcome.APOLOGY, pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION)));
    }

    // ==================== stored without reply ====================

    @Test
    void groupMessagesAreStoredWithoutReply() {
        String group = "120363012345678901@g.us";

        PipelineOutcome outcome = pipeline.processMessage(inbound("m-1", group, QUESTION));

        assertEquals(PipelineOutcome.STORED_ONLY, outcome);
        verifyNoInteractions(quotaPort);
        verify(channel, never()).sendText(any(), any(), any());
        assertEquals(1, historyOf(group).size());
    }

    @Test
    void commandsAreStoredWithoutReply() {
        assertEquals(PipelineOutcome.STORED_ONLY, pipeline.processMessage(inbound("m-1", ADDRESS, "/help")));
        verify(generatorPort, never()).generate(any());
    }

    @Test
    void disabledAutoReplyStoresOnly() {
        properties.getPipeline().setAutoReplyEnabled(false);

        assertEquals(PipelineOutcome.STORED_ONLY, pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION)));
        assertEquals(1, historyOf(ADDRESS).size());
    }

    // ==================== dropped ====================

    @Test
    void duplicateDeliveryIsDropped() {
        generatorReplies("Bonjour");

        assertEquals(PipelineOutcome.REPLIED, pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION)));
        assertEquals(PipelineOutcome.DROPPED, pipeline.processMessage(inbound("m-1", ADDRESS, QUESTION)));

        verify(generatorPort, times(1)).generate(any());
    }

    @Test
    void unresolvableAddressIsDropped() {
        assertEquals(PipelineOutcome.DROPPED, pipeline.processMessage(inbound("m-1", "@s.whatsapp.net", QUESTION)));
        verifyNoInteractions(generatorPort);
    }

    // ==================== media ====================

    @Test
    void mediaIsDownloadedAnalyzedAndUsedForRetrieval() {
        MediaDescriptor image = MediaDescriptor.builder()
                .kind(MediaKind.IMAGE)
                .reference("media-1")
                .mimeType("image/jpeg")
                .build();
        byte[] bytes = { 1, 2, 3 };
        when(mediaAnalysisPort.requiresContent(image)).thenReturn(true);
        when(channel.downloadMedia(SESSION, "media-1")).thenReturn(CompletableFuture.completedFuture(bytes));
        when(mediaAnalysisPort.analyze(eq(image), eq(bytes))).thenReturn(CompletableFuture.completedFuture(
                MediaAnalysis.builder()
                        .kind(MediaKind.IMAGE)
                        .description("Container ship at port")
                        .title("transport maritime")
                        .build()));
        generatorReplies("Voici nos tarifs");

        InboundMessage message = inbound("m-1", ADDRESS, "");
        message.setMedia(image);

        assertEquals(PipelineOutcome.REPLIED, pipeline.processMessage(message));

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generatorPort).generate(request.capture());
        assertTrue(request.getValue().getSystemContext().contains("Container ship at port"));
        assertTrue(request.getValue().getSystemContext().contains("850 USD/CBM"));
    }

    @Test
    void failedMediaDownloadFallsBackToDescription() {
        MediaDescriptor image = MediaDescriptor.builder()
                .kind(MediaKind.IMAGE)
                .reference("media-1")
                .caption("photo du colis")
                .build();
        when(mediaAnalysisPort.requiresContent(image)).thenReturn(true);
        when(channel.downloadMedia(SESSION, "media-1"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("gone")));
        generatorReplies("Merci pour la photo");

        InboundMessage message = inbound("m-1", ADDRESS, "");
        message.setMedia(image);

        assertEquals(PipelineOutcome.REPLIED, pipeline.processMessage(message));
        verify(mediaAnalysisPort, never()).analyze(any(), any());
    }
}
