package me.golemcore.converse.adapter.outbound.quota;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.QuotaCheckResult;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.QuotaPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Quota service client.
 *
 * <p>
 * Endpoint: {@code GET <url>/quota/messages/<ownerId>} answering
 * {@code {"allowed": true, "limit": 1000, "current": 120}}. A negative or
 * missing limit means unlimited. Transport and HTTP errors fail the returned
 * future; the caller decides whether to fail open.
 *
 * <p>
 * Configuration: {@code converse.quota.enabled}, {@code converse.quota.url},
 * {@code converse.quota.api-key}, {@code converse.quota.timeout}.
 */
@Component
@Slf4j
public class HttpQuotaAdapter implements QuotaPort {

    private final ConverseProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpQuotaAdapter(ConverseProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        long timeoutMs = properties.getQuota().getTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public CompletableFuture<QuotaCheckResult> check(String ownerId) {
        ConverseProperties.QuotaProperties config = properties.getQuota();
        if (!config.isEnabled() || config.getUrl() == null || config.getUrl().isBlank()) {
            return CompletableFuture.completedFuture(QuotaCheckResult.unlimited());
        }

        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = HttpUrl.get(config.getUrl()).newBuilder()
                    .addPathSegment("quota")
                    .addPathSegment("messages")
                    .addPathSegment(ownerId)
                    .build();
            Request.Builder requestBuilder = new Request.Builder().url(url).get();
            if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + config.getApiKey());
            }

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new IllegalStateException("Quota service returned HTTP " + response.code());
                }
                return parse(body.string());
            } catch (IOException e) {
                throw new UncheckedIOException("Quota request failed: " + e.getMessage(), e);
            }
        });
    }

    QuotaCheckResult parse(String json) throws IOException {
        JsonNode node = objectMapper.readTree(json);
        JsonNode limitNode = node.get("limit");
        if (limitNode == null || limitNode.isNull() || limitNode.asLong() < 0) {
            return QuotaCheckResult.unlimited();
        }
        long limit = limitNode.asLong();
        long current = node.path("current").asLong(0);
        boolean allowed = node.has("allowed") ? node.get("allowed").asBoolean() : current < limit;
        return allowed ? QuotaCheckResult.allowed(limit, current) : QuotaCheckResult.denied(limit, current);
    }
}
