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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import me.golemcore.converse.domain.model.KnowledgeDocument;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Cache of knowledge documents per knowledge base id. Documents change only
 * when the ingestion side reprocesses them, so a short write expiry is enough.
 */
@Configuration
public class KnowledgeCacheConfig {

    private static final long MAX_KNOWLEDGE_BASES = 500;

    @Bean
    public Cache<String, List<KnowledgeDocument>> knowledgeDocumentCache(ConverseProperties properties) {
        Duration ttl = properties.getKnowledge().getCacheTtl();
        return Caffeine.newBuilder()
                .maximumSize(MAX_KNOWLEDGE_BASES)
                .expireAfterWrite(ttl != null && !ttl.isNegative() ? ttl : Duration.ofMinutes(5))
                .build();
    }
}
