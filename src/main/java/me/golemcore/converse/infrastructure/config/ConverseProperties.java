package me.golemcore.converse.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code converse.*} prefix with one
 * nested class per subsystem:
 * <ul>
 * <li>{@link StorageProperties} - filesystem workspace of the durable
 * tier</li>
 * <li>{@link MemoryProperties} - memory tier bounds and sweep interval</li>
 * <li>{@link PersistenceProperties} - durable write timeouts and duplicate
 * windows</li>
 * <li>{@link KnowledgeProperties} - retrieval weights and excerpt sizes</li>
 * <li>{@link SummarizerProperties}, {@link ContextProperties},
 * {@link GenerationProperties} - prompt assembly and generation</li>
 * <li>{@link QuotaProperties}, {@link MediaProperties},
 * {@link ChannelProperties} - external collaborators</li>
 * <li>{@link PipelineProperties}, {@link ReconciliationProperties} -
 * processing and maintenance</li>
 * </ul>
 *
 * <p>
 * Scoring weights and window sizes are product tuning, not algorithmic
 * constants, so every one of them is overridable here.
 */
@Component
@ConfigurationProperties(prefix = "converse")
@Data
public class ConverseProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private MemoryProperties memory = new MemoryProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private SummarizerProperties summarizer = new SummarizerProperties();
    private ContextProperties context = new ContextProperties();
    private GenerationProperties generation = new GenerationProperties();
    private QuotaProperties quota = new QuotaProperties();
    private MediaProperties media = new MediaProperties();
    private ChannelProperties channel = new ChannelProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private ReconciliationProperties reconciliation = new ReconciliationProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/converse";
        private String conversationsDirectory = "conversations";
        private String messagesDirectory = "messages";
        private String summariesDirectory = "summaries";
        private String knowledgeDirectory = "knowledge";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class MemoryProperties {
        private Duration conversationTtl = Duration.ofHours(24);
        private int maxConversations = 1000;
        private int maxMessagesPerConversation = 100;
        private Duration sweepInterval = Duration.ofMinutes(5);
        private long bytesPerConversation = 1024;
        private long bytesPerMessage = 512;
    }

    @Data
    public static class PersistenceProperties {
        private Duration timeout = Duration.ofSeconds(10);
        private Duration duplicateWindow = Duration.ofSeconds(5);
        private Duration listMergeWindow = Duration.ofSeconds(1);
        private int writerThreads = 2;
        private int lockStripes = 64;
    }

    @Data
    public static class KnowledgeProperties {
        private String defaultKnowledgeBaseId;
        private Map<String, String> bindings = new HashMap<>();
        private int titleWeight = 10;
        private int contentWeight = 2;
        private int keywordWeight = 5;
        private int maxResults = 5;
        private int minTokenLength = 3;
        private int excerptLength = 800;
        private int windowLeadIn = 100;
        private int sentenceSnapDistance = 100;
        private double sentenceEndRatio = 0.7;
        private int minContentLength = 10;
        private int fallbackMinContentLength = 50;
        private int fallbackMaxDocuments = 3;
        private int fallbackExcerptLength = 800;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private List<String> importantKeywords = new ArrayList<>(List.of(
                "prix", "tarif", "coût", "cout", "fcfa", "xaf", "usd", "dollar", "euro",
                "kg", "kilo", "kilogramme", "poids", "cbm", "volume",
                "transport", "fret", "cargo", "expédition", "expedition", "envoi", "livraison",
                "aérien", "aerien", "avion", "maritime", "bateau", "mer",
                "chine", "china", "guangzhou", "canton", "shenzhen", "yiwu",
                "cameroun", "douala", "yaoundé", "yaounde",
                "délai", "delai", "durée", "duree", "jours", "semaines",
                "douane", "dédouanement", "dedouanement",
                "contact", "téléphone", "telephone", "whatsapp", "adresse"));
    }

    @Data
    public static class SummarizerProperties {
        private boolean enabled = true;
        private int turnThreshold = 30;
        private int keepRecent = 10;
        private int resummarizeStep = 10;
        private int maxTokens = 500;
        private int messageCharLimit = 300;
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class ContextProperties {
        private String policy = """
                You are the customer service assistant of this business on WhatsApp.
                Be friendly, concise and professional. Reply in plain text without markdown.
                Keep each reply short enough to read comfortably in a chat.""";
        private String contactChannel = "a member of our team";
        private int recentTurns = 15;
        private int maxSystemContextChars = 0;
        private String defaultLanguage = "fr";
    }

    @Data
    public static class GenerationProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.5;
        private int maxTokens = 600;
        private double topP = 0.85;
        private double frequencyPenalty = 0.2;
        private double presencePenalty = 0.1;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class QuotaProperties {
        private boolean enabled = false;
        private String url;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(5);
        private boolean failOpen = true;
        private String limitReachedMessage = "Sorry, the monthly message limit has been reached. "
                + "Please contact the administrator to upgrade the plan.";
    }

    @Data
    public static class MediaProperties {
        private boolean enabled = false;
        private String url;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ChannelProperties {
        private String type = "whatsapp";
        private String gatewayUrl;
        private String apiKey;
        private Duration sendTimeout = Duration.ofSeconds(15);
        private Duration downloadTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class PipelineProperties {
        private boolean autoReplyEnabled = true;
        private boolean replyToGroups = false;
        private List<String> commandPrefixes = new ArrayList<>(List.of("/", "!"));
        private String apologyMessage = "Sorry, I cannot answer right now. A member of our team will get back to you shortly.";
        private int workerThreads = 8;
        private int maxQueuedPerIdentity = 100;
        private Duration inboundPersistTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class ReconciliationProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
    }
}
