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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.exception.GeneratorException;
import me.golemcore.converse.domain.exception.IdentityNotResolvableException;
import me.golemcore.converse.domain.model.ComposedContext;
import me.golemcore.converse.domain.model.ConversationIdentity;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.GenerationRequest;
import me.golemcore.converse.domain.model.GenerationResponse;
import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.model.KnowledgeExcerpt;
import me.golemcore.converse.domain.model.MediaAnalysis;
import me.golemcore.converse.domain.model.MediaDescriptor;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.domain.model.PipelineOutcome;
import me.golemcore.converse.domain.model.QuotaCheckResult;
import me.golemcore.converse.domain.service.ChannelAddressNormalizer;
import me.golemcore.converse.domain.service.ContextComposer;
import me.golemcore.converse.domain.service.ConversationStore;
import me.golemcore.converse.domain.service.ConversationSummarizer;
import me.golemcore.converse.domain.service.KnowledgeRetrievalService;
import me.golemcore.converse.domain.service.LanguageDetector;
import me.golemcore.converse.domain.service.QuotaGate;
import me.golemcore.converse.domain.service.ResponseDispatcher;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.inbound.ChannelPort;
import me.golemcore.converse.port.outbound.GeneratorPort;
import me.golemcore.converse.port.outbound.MediaAnalysisPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handles one inbound message from receipt to reply.
 *
 * <p>
 * Steps, in order: resolve the identity, find or create the conversation,
 * record the inbound turn, decide whether to answer, check the quota, analyze
 * attached media, retrieve knowledge, refresh the summary, compose the
 * context, generate, format and dispatch.
 *
 * <p>
 * Calls for one identity are serialized by
 * {@link me.golemcore.converse.domain.service.IdentityRunCoordinator}; this
 * class does not manage concurrency itself.
 */
@Component
@Slf4j
public class ConversationPipeline {

    private final ConversationStore store;
    private final QuotaGate quotaGate;
    private final KnowledgeRetrievalService knowledgeRetrievalService;
    private final ConversationSummarizer summarizer;
    private final ContextComposer contextComposer;
    private final LanguageDetector languageDetector;
    private final ResponseDispatcher dispatcher;
    private final GeneratorPort generatorPort;
    private final MediaAnalysisPort mediaAnalysisPort;
    private final ConverseProperties properties;
    private final Clock clock;
    private final Map<String, ChannelPort> channelRegistry = new ConcurrentHashMap<>();

    @SuppressWarnings("java:S107")
    public ConversationPipeline(ConversationStore store, QuotaGate quotaGate,
            KnowledgeRetrievalService knowledgeRetrievalService, ConversationSummarizer summarizer,
            ContextComposer contextComposer, LanguageDetector languageDetector, ResponseDispatcher dispatcher,
            GeneratorPort generatorPort, MediaAnalysisPort mediaAnalysisPort, List<ChannelPort> channelPorts,
            ConverseProperties properties, Clock clock) {
        this.store = store;
        this.quotaGate = quotaGate;
        this.knowledgeRetrievalService = knowledgeRetrievalService;
        this.summarizer = summarizer;
        this.contextComposer = contextComposer;
        this.languageDetector = languageDetector;
        this.dispatcher = dispatcher;
        this.generatorPort = generatorPort;
        this.mediaAnalysisPort = mediaAnalysisPort;
        this.properties = properties;
        this.clock = clock;
        for (ChannelPort port : channelPorts) {
            channelRegistry.put(port.getChannelType(), port);
        }
    }

    public PipelineOutcome processMessage(InboundMessage message) {
        log.debug("[Pipeline] Inbound {} from {} (owner={})", message.getMessageId(), message.getRawAddress(),
                message.getOwnerId());

        ConversationIdentity identity;
        try {
            identity = ChannelAddressNormalizer.resolve(message.getOwnerId(), message.getRawAddress());
        } catch (IdentityNotResolvableException e) {
            log.warn("[Pipeline] Dropping message {}: {}", message.getMessageId(), e.getMessage());
            return PipelineOutcome.DROPPED;
        }

        ConversationRecord conversation = store.findOrCreate(identity, message.getChannelSessionId(),
                message.getSenderName());
        if (!recordInbound(conversation, message)) {
            log.debug("[Pipeline] Duplicate delivery of {} ignored", message.getMessageId());
            return PipelineOutcome.DROPPED;
        }

        Optional<String> skipReason = skipReason(identity, message);
        if (skipReason.isPresent()) {
            log.debug("[Pipeline] Stored without reply ({}): conversation {}", skipReason.get(),
                    conversation.getId());
            return PipelineOutcome.STORED_ONLY;
        }

        QuotaCheckResult quota = quotaGate.check(identity.ownerId());
        if (!quota.isAllowed()) {
            dispatcher.dispatchNotice(conversation, quotaGate.limitReachedNotice());
            return PipelineOutcome.QUOTA_NOTICE;
        }

        MediaAnalysis mediaAnalysis = message.hasMedia() ? analyzeMedia(conversation, message.getMedia()) : null;
        String query = buildQuery(message, mediaAnalysis);
        List<KnowledgeExcerpt> excerpts = knowledgeRetrievalService.retrieveForOwner(identity.ownerId(), query);

        summarizer.summarizeIfDue(conversation.getId());
        ConversationSummary summary = store.getSummary(conversation.getId()).orElse(null);
        List<MessageRecord> history = store.listMessages(conversation.getId());
        String language = languageDetector.detect(message.getContent());

        ComposedContext context = contextComposer.compose(history, summary, excerpts, mediaAnalysis,
                message.getReplyContext(), language);
        log.debug("[Pipeline] Context for {}: {} chars, {} turns, {} excerpt(s), summary={}, language={}",
                conversation.getId(), context.getSystemContext().length(), context.getRecentTurns().size(),
                context.getExcerptCount(), context.isSummaryIncluded(), context.getLanguage());

        String reply;
        try {
            reply = generate(context);
        } catch (GeneratorException e) {
            log.warn("[Pipeline] Generation failed for {} ({}): {}", conversation.getId(), e.getKind(),
                    e.getMessage());
            dispatcher.dispatchNotice(conversation, properties.getPipeline().getApologyMessage());
            return PipelineOutcome.APOLOGY;
        }

        MessageRecord sent = dispatcher.dispatchReply(conversation, reply);
        log.info("[Pipeline] Replied in conversation {} ({}, {} excerpt(s))", conversation.getId(),
                sent.getDeliveryStatus(), excerpts.size());
        return PipelineOutcome.REPLIED;
    }

    /**
     * @return false when the message was already recorded
     */
    private boolean recordInbound(ConversationRecord conversation, InboundMessage message) {
        MessageRecord inbound = MessageRecord.builder()
                .id(message.getMessageId())
                .conversationId(conversation.getId())
                .content(message.getContent())
                .role(MessageRole.INBOUND_PARTY)
                .media(message.getMedia())
                .replyContext(message.getReplyContext())
                .createdAt(message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                .deliveryStatus(DeliveryStatus.RECEIVED)
                .build();

        CompletableFuture<Optional<MessageRecord>> persisted = store.appendMessage(conversation.getId(), inbound);
        long timeoutMs = properties.getPipeline().getInboundPersistTimeout().toMillis();
        try {
            return persisted.get(timeoutMs, TimeUnit.MILLISECONDS).isPresent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while recording inbound message", e);
        } catch (ExecutionException e) {
            log.warn("[Pipeline] Inbound {} kept in memory, durable write failed: {}", inbound.getId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return true;
        } catch (TimeoutException e) {
            log.warn("[Pipeline] Inbound {} durable write still pending after {}ms", inbound.getId(), timeoutMs);
            return true;
        }
    }

    private Optional<String> skipReason(ConversationIdentity identity, InboundMessage message) {
        ConverseProperties.PipelineProperties config = properties.getPipeline();
        if (!config.isAutoReplyEnabled()) {
            return Optional.of("auto-reply disabled");
        }
        if (identity.group() && !config.isReplyToGroups()) {
            return Optional.of("group chat");
        }
        String content = message.getContent() != null ? message.getContent().trim() : "";
        if (content.isEmpty() && !message.hasMedia()) {
            return Optional.of("empty message");
        }
        for (String prefix : config.getCommandPrefixes()) {
            if (!prefix.isEmpty() && content.startsWith(prefix)) {
                return Optional.of("command");
            }
        }
        return Optional.empty();
    }

    private MediaAnalysis analyzeMedia(ConversationRecord conversation, MediaDescriptor media) {
        try {
            byte[] content = null;
            if (mediaAnalysisPort.requiresContent(media)) {
                content = downloadMedia(conversation, media);
                if (content == null) {
                    return MediaAnalysis.describeOnly(media);
                }
            }
            MediaAnalysis analysis = mediaAnalysisPort.analyze(media, content)
                    .get(properties.getMedia().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return analysis != null ? analysis : MediaAnalysis.describeOnly(media);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return MediaAnalysis.describeOnly(media);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Pipeline] Media analysis failed for {}: {}", media.getKind(), e.getMessage());
            return MediaAnalysis.describeOnly(media);
        }
    }

    private byte[] downloadMedia(ConversationRecord conversation, MediaDescriptor media)
            throws InterruptedException {
        ChannelPort channel = channelRegistry.get(properties.getChannel().getType());
        if (channel == null) {
            return null;
        }
        try {
            return channel.downloadMedia(conversation.getLinkedChannelSessionId(), media.getReference())
                    .get(properties.getChannel().getDownloadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Pipeline] Media download failed for {}: {}", media.getReference(), e.getMessage());
            return null;
        }
    }

    private static String buildQuery(InboundMessage message, MediaAnalysis mediaAnalysis) {
        StringBuilder query = new StringBuilder();
        if (message.getContent() != null) {
            query.append(message.getContent());
        }
        if (message.getReplyContext() != null && message.getReplyContext().getQuotedText() != null) {
            query.append(' ').append(message.getReplyContext().getQuotedText());
        }
        if (mediaAnalysis != null) {
            if (mediaAnalysis.getTitle() != null) {
                query.append(' ').append(mediaAnalysis.getTitle());
            }
            if (mediaAnalysis.getExtractedText() != null) {
                query.append(' ').append(mediaAnalysis.getExtractedText());
            }
        }
        return query.toString().trim();
    }

    private String generate(ComposedContext context) {
        if (!generatorPort.isAvailable()) {
            throw new GeneratorException(GeneratorException.Kind.UNAVAILABLE, "Generator is not configured");
        }
        ConverseProperties.GenerationProperties config = properties.getGeneration();
        GenerationRequest request = GenerationRequest.builder()
                .systemContext(context.getSystemContext())
                .turns(context.getRecentTurns())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .topP(config.getTopP())
                .frequencyPenalty(config.getFrequencyPenalty())
                .presencePenalty(config.getPresencePenalty())
                .build();

        CompletableFuture<GenerationResponse> future = generatorPort.generate(request);
        long start = clock.millis();
        try {
            GenerationResponse response = future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (response == null || response.getText() == null || response.getText().isBlank()) {
                throw new GeneratorException(GeneratorException.Kind.ERROR, "Generator returned an empty reply");
            }
            log.debug("[Pipeline] Generated {} chars in {}ms", response.getText().length(), clock.millis() - start);
            return response.getText();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException(GeneratorException.Kind.ERROR, "Generation interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GeneratorException(GeneratorException.Kind.TIMEOUT,
                    "No reply within " + config.getTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GeneratorException generatorException) {
                throw generatorException;
            }
            throw new GeneratorException(GeneratorException.Kind.ERROR, cause.getMessage(), cause);
        }
    }

    /**
     * Published when the channel delivers a message.
     */
    public record InboundMessageEvent(InboundMessage message, Instant timestamp) {
    }
}
