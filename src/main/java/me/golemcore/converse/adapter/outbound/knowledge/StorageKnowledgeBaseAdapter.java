package me.golemcore.converse.adapter.outbound.knowledge;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.KnowledgeDocument;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.KnowledgeBasePort;
import me.golemcore.converse.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Knowledge bases stored as files under {@code knowledge/<knowledgeBaseId>/}.
 *
 * <p>
 * {@code .json} files hold a serialized {@link KnowledgeDocument}; {@code .md}
 * and {@code .txt} files are plain documents titled after their file name.
 * Document lists are cached per knowledge base for
 * {@code converse.knowledge.cache-ttl}.
 */
@Component
@Slf4j
public class StorageKnowledgeBaseAdapter implements KnowledgeBasePort {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ConverseProperties properties;
    private final Cache<String, List<KnowledgeDocument>> knowledgeDocumentCache;

    public StorageKnowledgeBaseAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            ConverseProperties properties, Cache<String, List<KnowledgeDocument>> knowledgeDocumentCache) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.knowledgeDocumentCache = knowledgeDocumentCache;
    }

    @Override
    public List<KnowledgeDocument> listDocuments(String knowledgeBaseId) {
        if (knowledgeBaseId == null || !SAFE_ID.matcher(knowledgeBaseId).matches()
                || knowledgeBaseId.startsWith(".")) {
            log.warn("[Knowledge] Rejected knowledge base id: {}", knowledgeBaseId);
            return List.of();
        }
        List<KnowledgeDocument> cached = knowledgeDocumentCache.getIfPresent(knowledgeBaseId);
        if (cached != null) {
            return cached;
        }
        List<KnowledgeDocument> loaded = load(knowledgeBaseId);
        knowledgeDocumentCache.put(knowledgeBaseId, loaded);
        return loaded;
    }

    /**
     * Drops cached documents so the next lookup re-reads storage.
     */
    public void invalidate(String knowledgeBaseId) {
        knowledgeDocumentCache.invalidate(knowledgeBaseId);
    }

    private List<KnowledgeDocument> load(String knowledgeBaseId) {
        String directory = properties.getStorage().getKnowledgeDirectory();
        List<String> paths = await(storagePort.listObjects(directory, knowledgeBaseId));
        List<KnowledgeDocument> documents = new ArrayList<>();
        for (String path : paths) {
            KnowledgeDocument document = readDocument(directory, path, knowledgeBaseId);
            if (document != null) {
                documents.add(document);
            }
        }
        log.debug("[Knowledge] Loaded {} documents from knowledge base {}", documents.size(), knowledgeBaseId);
        return List.copyOf(documents);
    }

    private KnowledgeDocument readDocument(String directory, String path, String knowledgeBaseId) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return null;
        }
        String baseName = fileName.substring(0, dot);
        String extension = fileName.substring(dot + 1);
        if (!"json".equals(extension) && !"md".equals(extension) && !"txt".equals(extension)) {
            return null;
        }

        String text = await(storagePort.getText(directory, path));
        if (text == null) {
            return null;
        }
        if (!"json".equals(extension)) {
            return KnowledgeDocument.builder()
                    .id(baseName)
                    .knowledgeBaseId(knowledgeBaseId)
                    .title(baseName.replace('_', ' '))
                    .content(text)
                    .status(KnowledgeDocument.Status.PROCESSED)
                    .build();
        }
        try {
            KnowledgeDocument document = objectMapper.readValue(text, KnowledgeDocument.class);
            if (document.getId() == null) {
                document.setId(baseName);
            }
            document.setKnowledgeBaseId(knowledgeBaseId);
            return document;
        } catch (IOException e) {
            log.warn("[Knowledge] Skipping unreadable document {}: {}", path, e.getMessage());
            return null;
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(properties.getPersistence().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading knowledge base", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to read knowledge base: " + e.getCause().getMessage(),
                    e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Timed out reading knowledge base", e);
        }
    }
}
