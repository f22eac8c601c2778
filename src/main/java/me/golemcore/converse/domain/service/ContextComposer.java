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
import me.golemcore.converse.domain.model.ComposedContext;
import me.golemcore.converse.domain.model.ConversationSummary;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.GenerationTurn;
import me.golemcore.converse.domain.model.KnowledgeExcerpt;
import me.golemcore.converse.domain.model.MediaAnalysis;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.domain.model.ReplyContext;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the generator input for one reply.
 *
 * <p>
 * The system context is made of ordered sections:
 * <ol>
 * <li>policy, reply language and the no-fabrication rule</li>
 * <li>summary of older turns</li>
 * <li>knowledge excerpts, or the instruction to redirect when there are none</li>
 * <li>shared media</li>
 * <li>quoted message</li>
 * </ol>
 * followed by the most recent raw turns not covered by the summary.
 *
 * <p>
 * With {@code converse.context.max-system-context-chars} set, only the summary
 * and media sections are shortened to fit.
 */
@Component
@Slf4j
public class ContextComposer {

    public static final String NO_FABRICATION_RULE = "Never invent prices, delays, conditions, contact details "
            + "or any other business fact. Only state what the knowledge section gives you.";

    public static final String KNOWLEDGE_IS_SOURCE_OF_TRUTH = "The excerpts below are the only source of truth "
            + "for prices, delays, conditions and contact details. Quote figures exactly as written.";

    static final String NO_KNOWLEDGE_TEMPLATE = "No knowledge base information is available for this question. "
            + "Do not give prices, delays or conditions. Tell the customer you do not have the exact information "
            + "and refer them to %s.";

    static final String MISSING_ANSWER_TEMPLATE = "If the excerpts do not answer the question, say so and "
            + "refer the customer to %s.";

    private static final Map<String, String> LANGUAGE_NAMES = Map.of(
            "fr", "French",
            "en", "English",
            "es", "Spanish",
            "de", "German");

    private static final String TRUNCATION_MARK = "...";

    static final String UNSUPPORTED_QUOTE = "[Unsupported message]";

    private static final Map<String, String> QUOTE_PLACEHOLDERS = Map.of(
            "image", "[Image without caption]",
            "video", "[Video without caption]",
            "audio", "[Voice message]",
            "document", "[Document without caption]",
            "sticker", "[Sticker]",
            "text", "[Empty message]");

    private final ConverseProperties properties;

    public ContextComposer(ConverseProperties properties) {
        this.properties = properties;
    }

    /**
     * @param history
     *            every turn of the conversation in order, including the inbound
     *            message being answered
     */
    public ComposedContext compose(List<MessageRecord> history, ConversationSummary summary,
            List<KnowledgeExcerpt> excerpts, MediaAnalysis media, ReplyContext replyContext, String language) {
        ConverseProperties.ContextProperties config = properties.getContext();
        String effectiveLanguage = language != null ? language : config.getDefaultLanguage();

        Section header = new Section(buildHeader(config, effectiveLanguage));
        Section summarySection = new Section(buildSummary(summary));
        Section knowledgeSection = new Section(buildKnowledge(excerpts, config.getContactChannel()));
        Section mediaSection = new Section(buildMedia(media));
        Section replySection = new Section(buildReply(replyContext, history));

        List<Section> sections = List.of(header, summarySection, knowledgeSection, mediaSection, replySection);
        if (config.getMaxSystemContextChars() > 0) {
            fitToBudget(sections, List.of(summarySection, mediaSection), config.getMaxSystemContextChars());
        }

        StringBuilder systemContext = new StringBuilder();
        for (Section section : sections) {
            if (section.text.isEmpty()) {
                continue;
            }
            if (systemContext.length() > 0) {
                systemContext.append("\n\n");
            }
            systemContext.append(section.text);
        }

        long covered = summary != null && !summarySection.text.isEmpty() ? summary.getCoveredThroughSequenceNumber()
                : 0;
        List<GenerationTurn> turns = recentTurns(history, covered, config.getRecentTurns());

        return ComposedContext.builder()
                .systemContext(systemContext.toString())
                .recentTurns(turns)
                .excerptCount(excerpts != null ? excerpts.size() : 0)
                .summaryIncluded(!summarySection.text.isEmpty())
                .replyContextIncluded(!replySection.text.isEmpty())
                .language(effectiveLanguage)
                .build();
    }

    static List<GenerationTurn> recentTurns(List<MessageRecord> history, long coveredThrough, int limit) {
        List<GenerationTurn> turns = new ArrayList<>();
        if (history == null) {
            return turns;
        }
        for (MessageRecord message : history) {
            if (message.isDurable() && message.getSequenceNumber() <= coveredThrough) {
                continue;
            }
            if (message.getRole() != MessageRole.INBOUND_PARTY
                    && message.getDeliveryStatus() == DeliveryStatus.FAILED) {
                continue;
            }
            String content = turnContent(message);
            if (content.isBlank()) {
                continue;
            }
            GenerationTurn.Speaker speaker = message.getRole() == MessageRole.INBOUND_PARTY
                    ? GenerationTurn.Speaker.USER
                    : GenerationTurn.Speaker.ASSISTANT;
            turns.add(new GenerationTurn(speaker, content));
        }
        if (turns.size() > limit) {
            return new ArrayList<>(turns.subList(turns.size() - limit, turns.size()));
        }
        return turns;
    }

    private static String turnContent(MessageRecord message) {
        String content = message.getContent() != null ? message.getContent() : "";
        if (message.getMedia() != null && message.getMedia().getKind() != null) {
            String label = message.getMedia().getKind().getLabel();
            return content.isBlank() ? label : label + " " + content;
        }
        return content;
    }

    private static String buildHeader(ConverseProperties.ContextProperties config, String language) {
        String languageName = LANGUAGE_NAMES.getOrDefault(language, language);
        StringBuilder header = new StringBuilder();
        if (config.getPolicy() != null && !config.getPolicy().isBlank()) {
            header.append(config.getPolicy().trim()).append("\n\n");
        }
        header.append("Reply only in ").append(languageName)
                .append(": the customer wrote in ").append(languageName).append(".\n");
        header.append("Write plain text without markdown, asterisks or underscores.\n");
        header.append(NO_FABRICATION_RULE);
        return header.toString();
    }

    private static String buildSummary(ConversationSummary summary) {
        if (summary == null || summary.getText() == null || summary.getText().isBlank()) {
            return "";
        }
        StringBuilder section = new StringBuilder("## Earlier in this conversation\n");
        section.append(summary.getText().trim());
        if (summary.getTopics() != null && !summary.getTopics().isEmpty()) {
            section.append("\nTopics: ").append(String.join(", ", summary.getTopics()));
        }
        return section.toString();
    }

    private static String buildKnowledge(List<KnowledgeExcerpt> excerpts, String contactChannel) {
        StringBuilder section = new StringBuilder("## Knowledge base\n");
        if (excerpts == null || excerpts.isEmpty()) {
            section.append(String.format(NO_KNOWLEDGE_TEMPLATE, contactChannel));
            return section.toString();
        }
        section.append(KNOWLEDGE_IS_SOURCE_OF_TRUTH).append('\n');
        section.append(String.format(MISSING_ANSWER_TEMPLATE, contactChannel)).append('\n');
        int index = 1;
        for (KnowledgeExcerpt excerpt : excerpts) {
            section.append("\n[").append(index++).append("] ")
                    .append(excerpt.getDocumentTitle() != null ? excerpt.getDocumentTitle() : "Untitled");
            if (excerpt.isFallback()) {
                section.append(" (general information)");
            }
            section.append('\n').append(excerpt.getText()).append('\n');
        }
        return section.toString().stripTrailing();
    }

    private static String buildMedia(MediaAnalysis media) {
        if (media == null || media.getKind() == null) {
            return "";
        }
        StringBuilder section = new StringBuilder("## Shared media\n");
        section.append(media.getKind().getLabel());
        if (media.getDescription() != null && !media.getDescription().isBlank()) {
            section.append(' ').append(media.getDescription().trim());
        }
        appendLine(section, "Extracted text", media.getExtractedText());
        appendLine(section, "Title", media.getTitle());
        appendLine(section, "Price shown", media.getPrice());
        appendLine(section, "Category", media.getCategory());
        appendLine(section, "Domain", media.getDomain());
        appendLine(section, "URL", media.getUrl());
        appendLine(section, "File", media.getFilename());
        section.append("\nAcknowledge the shared content in the reply. "
                + "Do not describe details that are not listed here.");
        return section.toString();
    }

    private static String buildReply(ReplyContext replyContext, List<MessageRecord> history) {
        if (replyContext == null
                || (isBlank(replyContext.getQuotedMessageId()) && isBlank(replyContext.getQuotedText()))) {
            return "";
        }
        StringBuilder section = new StringBuilder("## Quoted message\n");
        section.append("The customer is replying to this earlier message");
        if (!isBlank(replyContext.getQuotedType())) {
            section.append(" (").append(replyContext.getQuotedType()).append(')');
        }
        section.append(":\n\"").append(quotedText(replyContext, history)).append("\"\n");
        section.append("Read the new message in the light of the quoted one.");
        return section.toString();
    }

    static String quotedText(ReplyContext replyContext, List<MessageRecord> history) {
        if (!isBlank(replyContext.getQuotedText())) {
            return replyContext.getQuotedText().trim();
        }
        String quotedId = replyContext.getQuotedMessageId();
        if (quotedId != null && history != null) {
            for (MessageRecord message : history) {
                if (quotedId.equals(message.getId())) {
                    String content = turnContent(message);
                    if (!content.isBlank()) {
                        return content.trim();
                    }
                    break;
                }
            }
        }
        return QUOTE_PLACEHOLDERS.getOrDefault(
                replyContext.getQuotedType() != null ? replyContext.getQuotedType().toLowerCase(Locale.ROOT) : "",
                UNSUPPORTED_QUOTE);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void appendLine(StringBuilder section, String label, String value) {
        if (value != null && !value.isBlank()) {
            section.append("\n- ").append(label).append(": ").append(value.trim());
        }
    }

    private static void fitToBudget(List<Section> all, List<Section> shrinkable, int budget) {
        int total = totalLength(all);
        for (Section section : shrinkable) {
            int excess = total - budget;
            if (excess <= 0) {
                return;
            }
            int before = section.text.length();
            int keep = before - excess - TRUNCATION_MARK.length();
            if (keep <= 0) {
                section.text = "";
            } else {
                section.text = section.text.substring(0, keep).stripTrailing() + TRUNCATION_MARK;
            }
            total = totalLength(all);
            log.debug("[Pipeline] Shortened a context section from {} to {} chars", before, section.text.length());
        }
    }

    private static int totalLength(List<Section> sections) {
        int total = 0;
        int nonEmpty = 0;
        for (Section section : sections) {
            if (!section.text.isEmpty()) {
                total += section.text.length();
                nonEmpty++;
            }
        }
        return total + Math.max(0, nonEmpty - 1) * 2;
    }

    private static final class Section {

        private String text;

        Section(String text) {
            this.text = text;
        }
    }
}
