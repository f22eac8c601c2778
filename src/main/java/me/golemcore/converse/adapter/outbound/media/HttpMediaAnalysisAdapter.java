package me.golemcore.converse.adapter.outbound.media;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.MediaAnalysis;
import me.golemcore.converse.domain.model.MediaDescriptor;
import me.golemcore.converse.domain.model.MediaKind;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.MediaAnalysisPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Media analysis service client.
 *
 * <p>
 * Endpoint: {@code POST <url>/analyze} with the media descriptor and, for
 * attachments, the base64 content. The response maps onto
 * {@link MediaAnalysis}. Links are analyzed from their URL alone.
 *
 * <p>
 * When the service is disabled or fails, the analysis degrades to the caption
 * carried by the message.
 */
@Component
@Slf4j
public class HttpMediaAnalysisAdapter implements MediaAnalysisPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final ConverseProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpMediaAnalysisAdapter(ConverseProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        long timeoutMs = properties.getMedia().getTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public boolean requiresContent(MediaDescriptor media) {
        return isEnabled() && media != null && media.getKind() != null && media.getKind() != MediaKind.LINK;
    }

    @Override
    public CompletableFuture<MediaAnalysis> analyze(MediaDescriptor media, byte[] content) {
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(MediaAnalysis.describeOnly(media));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                AnalyzeRequest payload = new AnalyzeRequest(
                        media.getKind().name().toLowerCase(Locale.ROOT),
                        media.getReference(),
                        media.getMimeType(),
                        media.getFilename(),
                        media.getCaption(),
                        content != null ? Base64.getEncoder().encodeToString(content) : null);
                Request.Builder requestBuilder = new Request.Builder()
                        .url(properties.getMedia().getUrl() + "/analyze")
                        .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON));
                String apiKey = properties.getMedia().getApiKey();
                if (apiKey != null && !apiKey.isBlank()) {
                    requestBuilder.header("Authorization", "Bearer " + apiKey);
                }

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody body = response.body();
                    if (!response.isSuccessful() || body == null) {
                        log.warn("[Pipeline] Media analysis failed: HTTP {}", response.code());
                        return MediaAnalysis.describeOnly(media);
                    }
                    MediaAnalysis analysis = objectMapper.readValue(body.string(), MediaAnalysis.class);
                    if (analysis.getKind() == null) {
                        analysis.setKind(media.getKind());
                    }
                    return analysis;
                }
            } catch (Exception e) { // NOSONAR - analysis is optional, degrade to the caption
                log.warn("[Pipeline] Media analysis error: {}", e.getMessage());
                return MediaAnalysis.describeOnly(media);
            }
        });
    }

    private boolean isEnabled() {
        ConverseProperties.MediaProperties config = properties.getMedia();
        return config.isEnabled() && config.getUrl() != null && !config.getUrl().isBlank();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AnalyzeRequest(String kind, String reference, String mimeType, String filename, String caption,
            String contentBase64) {
    }
}
