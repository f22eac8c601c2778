package me.golemcore.converse.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.converse.domain.exception.GeneratorException;
import me.golemcore.converse.domain.model.GenerationRequest;
import me.golemcore.converse.domain.model.GenerationResponse;
import me.golemcore.converse.domain.model.GenerationTurn;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class Langchain4jGeneratorAdapterTest {

    private ConverseProperties properties;
    private ChatModel chatModel;
    private Langchain4jGeneratorAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ConverseProperties();
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jGeneratorAdapter(properties, chatModel);
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder()
                .systemContext("Reply only in French.")
                .turns(List.of(
                        new GenerationTurn(GenerationTurn.Speaker.USER, "Bonjour"),
                        new GenerationTurn(GenerationTurn.Speaker.ASSISTANT, "Bonjour, comment puis-je aider ?"),
                        new GenerationTurn(GenerationTurn.Speaker.USER, "Prix du maritime ?")))
                .temperature(0.5)
                .maxTokens(600)
                .topP(0.85)
                .frequencyPenalty(0.2)
                .presencePenalty(0.1)
                .build();
    }

    @Test
    void generatesReplyWithUsage() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("850 USD/CBM"))
                .tokenUsage(new TokenUsage(120, 8))
                .build());

        GenerationResponse response = adapter.generate(request()).get();

        assertEquals("850 USD/CBM", response.getText());
        assertEquals("gpt-4o-mini", response.getModel());
        assertEquals(120, response.getUsage().getInputTokens());
        assertEquals(128, response.getUsage().getTotalTokens());
    }

    @Test
    void requestCarriesSystemContextTurnsAndSampling() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        adapter.generate(request()).get();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue().messages();
        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("Prix du maritime ?", ((UserMessage) messages.get(3)).singleText());
        assertEquals(0.5, captor.getValue().parameters().temperature().doubleValue());
        assertEquals(600, captor.getValue().parameters().maxOutputTokens().intValue());
    }

    @Test
    void modelFailureBecomesGeneratorError() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("HTTP 500"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.generate(request()).get());
        GeneratorException cause = assertInstanceOf(GeneratorException.class, error.getCause());
        assertEquals(GeneratorException.Kind.ERROR, cause.getKind());
    }

    @Test
    void unconfiguredGeneratorIsUnavailable() {
        Langchain4jGeneratorAdapter unconfigured = new Langchain4jGeneratorAdapter(properties);

        assertFalse(unconfigured.isAvailable());
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> unconfigured.generate(request()).get());
        assertEquals(GeneratorException.Kind.UNAVAILABLE, ((GeneratorException) error.getCause()).getKind());
    }

    @Test
    void apiKeyMakesGeneratorAvailable() {
        properties.getGeneration().setApiKey("sk-test");

        assertTrue(new Langchain4jGeneratorAdapter(properties).isAvailable());
    }

    // ==================== error mapping ====================

    @Test
    void rateLimitDetectedFromMessageChain() {
        assertTrue(Langchain4jGeneratorAdapter.isRateLimitError(
                new RuntimeException("wrapped", new RuntimeException("429 Too Many Requests"))));
        assertFalse(Langchain4jGeneratorAdapter.isRateLimitError(new RuntimeException("HTTP 500")));
    }

    @Test
    void socketTimeoutMapsToTimeoutKind() {
        GeneratorException mapped = Langchain4jGeneratorAdapter.toGeneratorException(
                new RuntimeException("io", new SocketTimeoutException("read timed out")));

        assertEquals(GeneratorException.Kind.TIMEOUT, mapped.getKind());
    }
}
