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

import me.golemcore.converse.infrastructure.config.ConverseProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Cuts a bounded excerpt out of a document around the area where the search
 * terms are densest.
 */
final class ExcerptExtractor {

    static final String ELLIPSIS = "...";

    private final int maxLength;
    private final int leadIn;
    private final int sentenceSnapDistance;
    private final double sentenceEndRatio;

    ExcerptExtractor(ConverseProperties.KnowledgeProperties config) {
        this(config.getExcerptLength(), config.getWindowLeadIn(), config.getSentenceSnapDistance(),
                config.getSentenceEndRatio());
    }

    ExcerptExtractor(int maxLength, int leadIn, int sentenceSnapDistance, double sentenceEndRatio) {
        this.maxLength = maxLength;
        this.leadIn = leadIn;
        this.sentenceSnapDistance = sentenceSnapDistance;
        this.sentenceEndRatio = sentenceEndRatio;
    }

    String extract(String content, Collection<String> terms) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        List<Integer> positions = findPositions(content.toLowerCase(Locale.ROOT), terms);
        if (positions.isEmpty()) {
            return head(content, maxLength);
        }

        int bestStart = 0;
        int bestCount = 0;
        for (int position : positions) {
            int windowStart = Math.max(0, position - leadIn);
            int windowEnd = windowStart + maxLength;
            int count = 0;
            for (int candidate : positions) {
                if (candidate >= windowStart && candidate <= windowEnd) {
                    count++;
                }
            }
            if (count > bestCount) {
                bestCount = count;
                bestStart = windowStart;
            }
        }
        bestStart = Math.min(bestStart, content.length());

        int sentenceStart = content.lastIndexOf('.', bestStart);
        if (sentenceStart != -1 && bestStart - sentenceStart < sentenceSnapDistance) {
            bestStart = sentenceStart + 1;
        }

        int end = Math.min(content.length(), bestStart + maxLength);
        String excerpt = content.substring(bestStart, end).trim();

        int lastPeriod = excerpt.lastIndexOf('.');
        if (lastPeriod > excerpt.length() * sentenceEndRatio) {
            excerpt = excerpt.substring(0, lastPeriod + 1);
        }

        if (bestStart > 0) {
            excerpt = ELLIPSIS + excerpt;
        }
        if (end < content.length() && !excerpt.endsWith(".")) {
            excerpt = excerpt + ELLIPSIS;
        }
        return excerpt;
    }

    static String head(String content, int length) {
        if (content == null) {
            return "";
        }
        if (content.length() <= length) {
            return content;
        }
        return content.substring(0, length) + ELLIPSIS;
    }

    private static List<Integer> findPositions(String lowerContent, Collection<String> terms) {
        List<Integer> positions = new ArrayList<>();
        for (String term : terms) {
            if (term == null || term.isEmpty()) {
                continue;
            }
            int pos = 0;
            while ((pos = lowerContent.indexOf(term, pos)) != -1) {
                positions.add(pos);
                pos += term.length();
            }
        }
        positions.sort(Integer::compare);
        return positions;
    }
}
