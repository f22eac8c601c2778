package me.golemcore.converse.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.exception.GeneratorException;
import me.golemcore.converse.domain.model.GenerationRequest;
import me.golemcore.converse.domain.model.GenerationResponse;
import me.golemcore.converse.domain.model.GenerationTurn;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.GeneratorPort;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text generator backed by an OpenAI-compatible chat endpoint through
 * langchain4j.
 *
 * <p>
 * The chat model is built lazily from {@code converse.generation.*}; the
 * generator reports itself unavailable while no API key is configured. Rate
 * limit responses are retried with exponential backoff, every other failure is
 * mapped to a {@link GeneratorException}.
 */
@Component
@Slf4j
public class Langchain4jGeneratorAdapter implements GeneratorPort {

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final ConverseProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jGeneratorAdapter(ConverseProperties properties) {
        this.properties = properties;
    }

    Langchain4jGeneratorAdapter(ConverseProperties properties, ChatModel chatModel) {
        this.properties = properties;
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public boolean isAvailable() {
        if (initialized && chatModel != null) {
            return true;
        }
        String apiKey = properties.getGeneration().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<GenerationResponse> generate(GenerationRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = ensureInitialized();
            if (model == null) {
                throw new GeneratorException(GeneratorException.Kind.UNAVAILABLE, "Generator is not configured");
            }
            ChatRequest chatRequest = toChatRequest(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return toResponse(model.chat(chatRequest));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[Generator] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1,
                                MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        throw toGeneratorException(e);
                    }
                }
            }
            throw new GeneratorException(GeneratorException.Kind.ERROR, "Max retries exhausted");
        });
    }

    private synchronized ChatModel ensureInitialized() {
        if (initialized) {
            return chatModel;
        }
        ConverseProperties.GenerationProperties config = properties.getGeneration();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            return null;
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // retries handled here
                .timeout(config.getTimeout());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        chatModel = builder.build();
        initialized = true;
        log.info("[Generator] Initialized with model {}", config.getModel());
        return chatModel;
    }

    static ChatRequest toChatRequest(GenerationRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemContext() != null && !request.getSystemContext().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemContext()));
        }
        if (request.getTurns() != null) {
            for (GenerationTurn turn : request.getTurns()) {
                messages.add(turn.speaker() == GenerationTurn.Speaker.USER
                        ? UserMessage.from(turn.content())
                        : AiMessage.from(turn.content()));
            }
        }
        return ChatRequest.builder()
                .messages(messages)
                .temperature(request.getTemperature())
                .maxOutputTokens(request.getMaxTokens())
                .topP(request.getTopP())
                .frequencyPenalty(request.getFrequencyPenalty())
                .presencePenalty(request.getPresencePenalty())
                .build();
    }

    private GenerationResponse toResponse(ChatResponse response) {
        GenerationResponse.Usage usage = null;
        if (response.tokenUsage() != null) {
            usage = GenerationResponse.Usage.builder()
                    .inputTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        return GenerationResponse.builder()
                .text(text)
                .model(properties.getGeneration().getModel())
                .usage(usage)
                .build();
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static GeneratorException toGeneratorException(Throwable e) {
        if (e instanceof GeneratorException generatorException) {
            return generatorException;
        }
        Throwable current = e;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return new GeneratorException(GeneratorException.Kind.TIMEOUT, "Generator timed out", e);
            }
            current = current.getCause();
        }
        return new GeneratorException(GeneratorException.Kind.ERROR, "Generation failed: " + e.getMessage(), e);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GeneratorException(GeneratorException.Kind.ERROR, "Interrupted during retry backoff", ie);
        }
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
