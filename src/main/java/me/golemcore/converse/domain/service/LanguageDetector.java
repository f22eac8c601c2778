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
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guesses the language of an inbound message so that the reply can be written
 * in the same language.
 *
 * <p>
 * Keyword scoring: expressions specific to one language weigh three times
 * their length, common words weigh their length (one point for words of two
 * letters or less, matched as whole words). Short, weak or close results fall
 * back to the configured default language.
 */
@Component
@Slf4j
public class LanguageDetector {

    private static final int MIN_SCORE = 3;
    private static final int CLOSE_MARGIN = 5;
    private static final int SHORT_TEXT_WORDS = 2;
    private static final int SHORT_TEXT_CHARS = 15;

    private static final List<String> SHORT_ENGLISH = List.of(
            "hello", "hi", "hey", "yes", "no", "ok", "okay", "thanks", "please", "help", "what", "how", "why",
            "when", "where", "who", "can", "could", "would", "should", "need", "want", "buy", "price", "cost");

    private static final Map<String, Vocabulary> VOCABULARIES = new LinkedHashMap<>();

    static {
        VOCABULARIES.put("fr", new Vocabulary(
                List.of("bonjour", "bonsoir", "salut", "merci", "bienvenue", "s'il vous plaît", "svp", "oui",
                        "pourquoi", "parce que", "comment", "combien", "quoi", "quel", "quelle", "quand",
                        "aujourd'hui", "demain", "hier", "maintenant", "toujours", "jamais", "peut-être",
                        "beaucoup", "très", "aussi", "encore", "déjà", "seulement", "vraiment", "environ",
                        "pendant", "depuis", "jusqu'à", "avant", "après", "entre", "chez", "voici", "voilà",
                        "alors", "donc", "mais", "cependant", "d'accord", "j'ai", "j'aimerais", "je veux",
                        "je voudrais", "je cherche", "je suis", "vous êtes", "c'est", "est-ce que", "bien sûr"),
                List.of("le", "la", "les", "un", "une", "des", "du", "au", "aux", "ce", "cette", "ces", "mon",
                        "ma", "mes", "votre", "vos", "notre", "nos", "je", "tu", "il", "elle", "nous", "vous",
                        "ils", "elles", "qui", "que", "où", "et", "ou", "pour", "dans", "sur", "avec", "par",
                        "de", "à", "en")));
        VOCABULARIES.put("en", new Vocabulary(
                List.of("hello", "hey", "thanks", "thank you", "please", "welcome", "sorry", "goodbye", "bye",
                        "okay", "alright", "yes", "yeah", "maybe", "however", "because", "although", "actually",
                        "really", "already", "always", "never", "i am", "i'm", "you are", "i have", "i would",
                        "i will", "can you", "could you", "would you", "do you", "are you", "is it", "what is",
                        "what's", "how much", "how many", "how long"),
                List.of("the", "a", "an", "this", "that", "these", "those", "my", "your", "our", "their", "i",
                        "you", "he", "she", "it", "we", "they", "who", "what", "which", "when", "where", "why",
                        "how", "and", "or", "but", "if", "so", "for", "to", "of", "in", "on", "at", "by", "with",
                        "from", "about")));
        VOCABULARIES.put("es", new Vocabulary(
                List.of("hola", "gracias", "buenos días", "buenas tardes", "buenas noches", "por favor", "perdón",
                        "disculpe", "adiós", "hasta luego", "cómo estás", "qué tal", "muy bien", "está bien",
                        "de nada", "lo siento", "claro", "vale", "bueno", "pues", "entonces", "además",
                        "también", "todavía", "siempre", "nunca", "ahora", "hoy", "mañana", "ayer"),
                List.of("el", "la", "los", "las", "un", "una", "yo", "tú", "él", "ella", "nosotros", "ellos",
                        "mi", "tu", "su", "que", "qué", "cómo", "cuándo", "dónde", "quién", "cuánto", "y", "o",
                        "pero", "porque", "para", "por", "con", "sin", "en", "de", "a")));
        VOCABULARIES.put("de", new Vocabulary(
                List.of("guten tag", "guten morgen", "guten abend", "danke", "bitte", "entschuldigung",
                        "auf wiedersehen", "tschüss", "ja", "nein", "vielleicht", "natürlich", "genau",
                        "richtig", "falsch", "gut", "schlecht", "schön", "groß", "klein"),
                List.of("der", "die", "das", "ein", "eine", "ich", "du", "er", "sie", "es", "wir", "ihr", "mein",
                        "dein", "sein", "unser", "was", "wie", "wann", "wo", "warum", "wer", "und", "oder",
                        "aber", "weil", "wenn", "dass", "für", "mit", "von", "zu", "in", "an", "auf")));
    }

    private final ConverseProperties properties;

    public LanguageDetector(ConverseProperties properties) {
        this.properties = properties;
    }

    public String detect(String text) {
        String defaultLanguage = properties.getContext().getDefaultLanguage();
        if (text == null || text.isBlank()) {
            return defaultLanguage;
        }
        String lower = text.toLowerCase(Locale.ROOT).trim();

        if (lower.split("\\s+").length <= SHORT_TEXT_WORDS && lower.length() < SHORT_TEXT_CHARS) {
            for (String word : SHORT_ENGLISH) {
                if (lower.equals(word) || lower.startsWith(word + " ") || lower.endsWith(" " + word)) {
                    return "en";
                }
            }
            return defaultLanguage;
        }

        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Map.Entry<String, Vocabulary> entry : VOCABULARIES.entrySet()) {
            scores.put(entry.getKey(), entry.getValue().score(lower));
        }

        List<Map.Entry<String, Integer>> ranked = scores.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .toList();
        String best = ranked.get(0).getKey();
        int bestScore = ranked.get(0).getValue();
        int secondScore = ranked.get(1).getValue();
        log.trace("[Pipeline] Language scores {} -> {}", scores, best);

        if (bestScore < MIN_SCORE) {
            return defaultLanguage;
        }
        if (secondScore > 0 && bestScore - secondScore < CLOSE_MARGIN
                && scores.getOrDefault(defaultLanguage, 0) >= secondScore) {
            return defaultLanguage;
        }
        return best;
    }

    private static final class Vocabulary {

        private final List<String> unique;
        private final List<String> common;
        private final List<Pattern> shortWords;

        Vocabulary(List<String> unique, List<String> common) {
            this.unique = unique;
            this.common = common.stream().filter(word -> word.length() > 2).toList();
            this.shortWords = common.stream()
                    .filter(word -> word.length() <= 2)
                    .map(word -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word)
                            + "(?![\\p{L}\\p{N}])"))
                    .toList();
        }

        int score(String lower) {
            int score = 0;
            for (String expression : unique) {
                if (lower.contains(expression)) {
                    score += expression.length() * 3;
                }
            }
            for (String word : common) {
                if (lower.contains(word)) {
                    score += word.length();
                }
            }
            for (Pattern pattern : shortWords) {
                if (pattern.matcher(lower).find()) {
                    score += 1;
                }
            }
            return score;
        }
    }
}
