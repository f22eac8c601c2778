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
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.GenerationRequest;
import me.golemcore.converse.domain.model.GenerationResponse;
import me.golemcore.converse.domain.model.GenerationTurn;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.GeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Maintains a rolling summary of the older turns of long conversations.
 *
 * <p>
 * A summary is produced once a conversation holds more than
 * {@code turnThreshold} turns, and refreshed when the turns it does not cover
 * exceed {@code keepRecent + resummarizeStep}. The newest {@code keepRecent}
 * turns are always left out so that they reach the generator verbatim. A
 * refresh folds the previous summary and the newly covered turns into one text.
 *
 * <p>
 * Only durable turns are summarized: coverage is expressed as a sequence
 * number. Failures leave the previous summary in place.
 */
@Service
@Slf4j
public class ConversationSummarizer {

    private static final double SUMMARY_TEMPERATURE = 0.3;

    private static final String SYSTEM_PROMPT = """
            You compress customer conversations held on a messaging channel.
            Write a short factual summary of the turns you are given.

            Include, when present:
            - the topics discussed
            - facts the customer stated (names, quantities, destinations, dates, budgets)
            - prices, delays or conditions the business already communicated
            - questions that are still pending

            Keep it factual. Write in the language the conversation uses.
            Do not add greetings, opinions or anything that was not said. Output only the summary.""";

    private static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();

    static {
        TOPIC_KEYWORDS.put("pricing", List.of("prix", "tarif", "coût", "cout", "price", "cost", "fcfa", "usd",
                "euro", "devis", "quote"));
        TOPIC_KEYWORDS.put("shipping", List.of("livraison", "transport", "expédition", "expedition", "envoi",
                "shipping", "delivery", "fret", "cargo", "maritime", "aérien", "aerien", "douane"));
        TOPIC_KEYWORDS.put("support", List.of("problème", "probleme", "aide", "help", "support", "issue",
                "réclamation", "reclamation", "complaint", "erreur", "error"));
        TOPIC_KEYWORDS.put("product", List.of("produit", "product", "article", "stock", "catalogue", "catalog",
                "modèle", "modele", "model"));
        TOPIC_KEYWORDS.put("account", List.of("compte", "account", "abonnement", "subscription", "facture",
                "invoice", "paiement", "payment", "mot de passe", "password"));
    }

    private final GeneratorPort generatorPort;
    private final ConversationStore store;
    private final ConverseProperties properties;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ConversationSummarizer(GeneratorPort generatorPort, ConversationStore store,
            ConverseProperties properties, Clock clock) {
        this.generatorPort = generatorPort;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Whether the conversation needs a new or refreshed summary.
     */
    public boolean shouldSummarize(List<MessageRecord> turns, ConversationSummary current) {
        ConverseProperties.SummarizerProperties config = properties.getSummarizer();
        if (!config.isEnabled() || turns.size() <= config.getTurnThreshold()) {
            return false;
        }
        if (current == null) {
            return true;
        }
        long covered = current.getCoveredThroughSequenceNumber();
        long uncovered = turns.stream()
                .filter(turn -> !turn.isDurable() || turn.getSequenceNumber() > covered)
                .count();
        return uncovered > config.getKeepRecent() + config.getResummarizeStep();
    }

    /**
     * Summarizes the conversation when due.
     *
     * @return the stored summary, or empty when none was due, another summary
     *         of the conversation was already running, or generation failed
     */
    public Optional<ConversationSummary> summarizeIfDue(String conversationId) {
        List<MessageRecord> turns = store.listMessages(conversationId);
        ConversationSummary current = store.getSummary(conversationId).orElse(null);
        if (!shouldSummarize(turns, current)) {
            return Optional.empty();
        }
        if (!inFlight.add(conversationId)) {
            log.debug("[Summarizer] Summary of {} already in progress", conversationId);
            return Optional.empty();
        }
        try {
            return summarize(conversationId, turns, current);
        } finally {
            inFlight.remove(conversationId);
        }
    }

    Optional<ConversationSummary> summarize(String conversationId, List<MessageRecord> turns,
            ConversationSummary current) {
        List<MessageRecord> slice = selectSlice(turns, current);
        if (slice.isEmpty()) {
            return Optional.empty();
        }
        if (generatorPort == null || !generatorPort.isAvailable()) {
            log.warn("[Summarizer] Generator not available, keeping previous summary of {}", conversationId);
            return Optional.empty();
        }

        String previous = current != null ? current.getText() : null;
        String text = requestSummary(previous, slice);
        if (text == null) {
            return Optional.empty();
        }

        ConversationSummary summary = ConversationSummary.builder()
                .conversationId(conversationId)
                .text(text)
                .coveredThroughSequenceNumber(slice.get(slice.size() - 1).getSequenceNumber())
                .topics(detectTopics(previous, slice))
                .createdAt(clock.instant())
                .build();
        if (!store.updateSummary(conversationId, summary)) {
            log.debug("[Summarizer] A newer summary of {} already exists", conversationId);
            return Optional.empty();
        }
        log.info("[Summarizer] Summary of {} now covers through #{} ({} new turns, topics {})",
                conversationId, summary.getCoveredThroughSequenceNumber(), slice.size(), summary.getTopics());
        return Optional.of(summary);
    }

    /**
     * Durable turns past the current coverage, excluding the newest
     * {@code keepRecent} turns. Stops at the first turn that is not durable yet.
     */
    List<MessageRecord> selectSlice(List<MessageRecord> turns, ConversationSummary current) {
        int keepRecent = properties.getSummarizer().getKeepRecent();
        int end = turns.size() - keepRecent;
        long covered = current != null ? current.getCoveredThroughSequenceNumber() : 0;
        List<MessageRecord> slice = new ArrayList<>();
        for (int i = 0; i < end; i++) {
            MessageRecord turn = turns.get(i);
            if (!turn.isDurable()) {
                break;
            }
            if (turn.getSequenceNumber() > covered) {
                slice.add(turn);
            }
        }
        return slice;
    }

    static List<String> detectTopics(String previousSummary, List<MessageRecord> turns) {
        StringBuilder text = new StringBuilder();
        if (previousSummary != null) {
            text.append(previousSummary).append('\n');
        }
        for (MessageRecord turn : turns) {
            if (turn.getContent() != null) {
                text.append(turn.getContent()).append('\n');
            }
        }
        String lower = text.toString().toLowerCase(Locale.ROOT);
        List<String> topics = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : TOPIC_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                topics.add(entry.getKey());
            }
        }
        return topics;
    }

    private String requestSummary(String previousSummary, List<MessageRecord> slice) {
        ConverseProperties.SummarizerProperties config = properties.getSummarizer();
        StringBuilder prompt = new StringBuilder();
        if (previousSummary != null && !previousSummary.isBlank()) {
            prompt.append("Summary of the earlier part of the conversation:\n")
                    .append(previousSummary)
                    .append("\n\nMerge it with the following turns into one summary.\n\n");
        } else {
            prompt.append("Summarize the following turns.\n\n");
        }
        prompt.append(formatConversation(slice, config.getMessageCharLimit()));

        GenerationRequest request = GenerationRequest.builder()
                .systemContext(SYSTEM_PROMPT)
                .turns(List.of(new GenerationTurn(GenerationTurn.Speaker.USER, prompt.toString())))
                .maxTokens(config.getMaxTokens())
                .temperature(SUMMARY_TEMPERATURE)
                .build();

        CompletableFuture<GenerationResponse> future = null;
        try {
            long start = clock.millis();
            future = generatorPort.generate(request);
            GenerationResponse response = future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            String summary = response != null ? response.getText() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[Summarizer] Generator returned an empty summary");
                return null;
            }
            log.debug("[Summarizer] Summarized {} turns in {}ms", slice.size(), clock.millis() - start);
            return summary.trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Summarizer] Summarization interrupted: {}", e.getMessage());
            return null;
        } catch (ExecutionException | TimeoutException e) {
            if (future != null) {
                future.cancel(true);
            }
            log.warn("[Summarizer] Summarization failed: {}", e.getMessage());
            return null;
        }
    }

    private static String formatConversation(List<MessageRecord> turns, int charLimit) {
        return turns.stream()
                .map(turn -> label(turn.getRole()) + ": " + truncate(contentOf(turn), charLimit))
                .collect(Collectors.joining("\n"));
    }

    private static String contentOf(MessageRecord turn) {
        if ((turn.getContent() == null || turn.getContent().isBlank()) && turn.getMedia() != null
                && turn.getMedia().getKind() != null) {
            return turn.getMedia().getKind().getLabel();
        }
        return turn.getContent();
    }

    private static String label(MessageRole role) {
        if (role == null) {
            return "unknown";
        }
        return switch (role) {
        case INBOUND_PARTY -> "customer";
        case AUTOMATED_AGENT -> "assistant";
        case OPERATOR -> "operator";
        };
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
