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
import me.golemcore.converse.domain.model.KnowledgeDocument;
import me.golemcore.converse.domain.model.KnowledgeExcerpt;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.KnowledgeBasePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword retrieval over the documents of a knowledge base.
 *
 * <p>
 * Each processed document is scored against the query terms and the important
 * keywords found in the query. Title hits weigh more than content hits. The
 * highest scoring documents are returned as excerpts centred on the densest
 * cluster of matches. When nothing matches, the first few substantial documents
 * are returned as general context and flagged as fallback.
 *
 * <p>
 * Results are deterministic: equal scores are ordered by title, then by id.
 */
@Service
@Slf4j
public class KnowledgeRetrievalService {

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,.'?!]+");

    private static final Comparator<ScoredDocument> BY_RELEVANCE = Comparator
            .comparingInt(ScoredDocument::score).reversed()
            .thenComparing(scored -> nullToEmpty(scored.document().getTitle()))
            .thenComparing(scored -> nullToEmpty(scored.document().getId()));

    private final KnowledgeBasePort knowledgeBasePort;
    private final ConverseProperties properties;

    public KnowledgeRetrievalService(KnowledgeBasePort knowledgeBasePort, ConverseProperties properties) {
        this.knowledgeBasePort = knowledgeBasePort;
        this.properties = properties;
    }

    /**
     * Retrieves excerpts from the knowledge base bound to the owner.
     */
    public List<KnowledgeExcerpt> retrieveForOwner(String ownerId, String query) {
        String knowledgeBaseId = resolveKnowledgeBaseId(ownerId);
        if (knowledgeBaseId == null) {
            log.debug("[Knowledge] No knowledge base bound to owner {}", ownerId);
            return List.of();
        }
        return retrieve(query, knowledgeBaseId);
    }

    public String resolveKnowledgeBaseId(String ownerId) {
        ConverseProperties.KnowledgeProperties config = properties.getKnowledge();
        String bound = ownerId != null ? config.getBindings().get(ownerId) : null;
        if (bound != null && !bound.isBlank()) {
            return bound;
        }
        String fallback = config.getDefaultKnowledgeBaseId();
        return fallback == null || fallback.isBlank() ? null : fallback;
    }

    public List<KnowledgeExcerpt> retrieve(String query, String knowledgeBaseId) {
        if (query == null || query.isBlank() || knowledgeBaseId == null) {
            return List.of();
        }
        ConverseProperties.KnowledgeProperties config = properties.getKnowledge();

        List<KnowledgeDocument> documents;
        try {
            documents = knowledgeBasePort.listDocuments(knowledgeBaseId);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Failed to load documents of {}: {}", knowledgeBaseId, e.getMessage());
            return List.of();
        }
        List<KnowledgeDocument> candidates = documents.stream()
                .filter(document -> document.getStatus() != null && document.getStatus().isSearchable())
                .filter(document -> document.getContent() != null
                        && document.getContent().length() > config.getMinContentLength())
                .toList();
        if (candidates.isEmpty()) {
            log.debug("[Knowledge] Knowledge base {} has no usable documents", knowledgeBaseId);
            return List.of();
        }

        String lowerQuery = query.toLowerCase(Locale.ROOT);
        List<String> keywords = matchImportantKeywords(lowerQuery, config.getImportantKeywords());
        Set<String> terms = new LinkedHashSet<>(tokenize(lowerQuery, config.getMinTokenLength()));
        terms.addAll(keywords);

        List<ScoredDocument> ranked = candidates.stream()
                .map(document -> new ScoredDocument(document, score(document, terms, keywords, config)))
                .filter(scored -> scored.score() > 0)
                .sorted(BY_RELEVANCE)
                .limit(config.getMaxResults())
                .toList();

        if (ranked.isEmpty()) {
            log.debug("[Knowledge] No match for terms {}, using fallback context", terms);
            return fallback(candidates, config);
        }

        ExcerptExtractor extractor = new ExcerptExtractor(config);
        List<KnowledgeExcerpt> excerpts = new ArrayList<>(ranked.size());
        for (ScoredDocument scored : ranked) {
            excerpts.add(KnowledgeExcerpt.builder()
                    .documentId(scored.document().getId())
                    .documentTitle(scored.document().getTitle())
                    .text(extractor.extract(scored.document().getContent(), terms))
                    .relevanceScore(scored.score())
                    .fallback(false)
                    .build());
        }
        log.debug("[Knowledge] {} excerpt(s) from {} (top score {})", excerpts.size(), knowledgeBaseId,
                ranked.get(0).score());
        return excerpts;
    }

    static List<String> tokenize(String lowerQuery, int minTokenLength) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SEPARATORS.split(lowerQuery)) {
            if (token.length() >= minTokenLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static List<String> matchImportantKeywords(String lowerQuery, List<String> vocabulary) {
        List<String> matched = new ArrayList<>();
        for (String keyword : vocabulary) {
            String lowerKeyword = keyword.toLowerCase(Locale.ROOT);
            if (!lowerKeyword.isEmpty() && lowerQuery.contains(lowerKeyword) && !matched.contains(lowerKeyword)) {
                matched.add(lowerKeyword);
            }
        }
        return matched;
    }

    static int score(KnowledgeDocument document, Set<String> terms, List<String> keywords,
            ConverseProperties.KnowledgeProperties config) {
        String title = nullToEmpty(document.getTitle()).toLowerCase(Locale.ROOT);
        String content = nullToEmpty(document.getContent()).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (title.contains(term)) {
                score += config.getTitleWeight();
            }
            score += countOccurrences(content, term) * config.getContentWeight();
        }
        for (String keyword : keywords) {
            if (content.contains(keyword)) {
                score += config.getKeywordWeight();
            }
        }
        return score;
    }

    private List<KnowledgeExcerpt> fallback(List<KnowledgeDocument> candidates,
            ConverseProperties.KnowledgeProperties config) {
        return candidates.stream()
                .filter(document -> document.getContent().length() > config.getFallbackMinContentLength())
                .sorted(Comparator.comparing((KnowledgeDocument document) -> nullToEmpty(document.getTitle()))
                        .thenComparing(document -> nullToEmpty(document.getId())))
                .limit(config.getFallbackMaxDocuments())
                .map(document -> KnowledgeExcerpt.builder()
                        .documentId(document.getId())
                        .documentTitle(document.getTitle())
                        .text(ExcerptExtractor.head(document.getContent(), config.getFallbackExcerptLength()))
                        .relevanceScore(0)
                        .fallback(true)
                        .build())
                .toList();
    }

    private static int countOccurrences(String text, String term) {
        if (term.isEmpty()) {
            return 0;
        }
        int count = 0;
        int pos = 0;
        while ((pos = text.indexOf(term, pos)) != -1) {
            count++;
            pos += term.length();
        }
        return count;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record ScoredDocument(KnowledgeDocument document, int score) {
    }
}
