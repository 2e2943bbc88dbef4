package com.openforge.taskcore.llm;

import com.openforge.taskcore.llm.model.ChatRequest;
import com.openforge.taskcore.llm.model.ChatResponse;
import com.openforge.taskcore.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmRouterTest {

    private LlmClient primary;
    private LlmClient fallback;

    @BeforeEach
    void setUp() {
        primary = mock(LlmClient.class);
        fallback = mock(LlmClient.class);
        when(primary.modelName()).thenReturn("gemini-2.0-flash");
        when(fallback.modelName()).thenReturn("deepseek-chat");
    }

    private static Retry noRetry(String name) {
        return Retry.of(name, RetryConfig.custom().maxAttempts(1).build());
    }

    private LlmRouter router(LlmClient fallbackClient) {
        return new LlmRouter(primary, fallbackClient,
                CircuitBreaker.ofDefaults("primary-test"), CircuitBreaker.ofDefaults("fallback-test"),
                noRetry("primary-test"), noRetry("fallback-test"));
    }

    private static ChatResponse answer(String content) {
        return new ChatResponse("id-1", "chat.completion", 0L, "m",
                List.of(new ChatResponse.Choice(0, Message.assistant(content), "stop")), null);
    }

    @Test
    @DisplayName("complete() sends system + user messages with the requested sampling settings")
    void completeBuildsRequest() {
        when(primary.chat(any())).thenReturn(answer("{\"customerId\":\"1\"}"));

        String text = router(fallback).complete("be terse", "extract", 0.1, 4096);

        assertEquals("{\"customerId\":\"1\"}", text);
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(primary).chat(request.capture());
        assertEquals("gemini-2.0-flash", request.getValue().model());
        assertEquals(0.1, request.getValue().temperature(), 1e-9);
        assertEquals(4096, request.getValue().maxTokens());
        assertEquals(List.of(Message.system("be terse"), Message.user("extract")), request.getValue().messages());
        verifyNoInteractions(fallback);
    }

    @Test
    void fallbackTakesOverWhenPrimaryFails() {
        when(primary.chat(any())).thenThrow(new LlmClient.LlmException("primary down"));
        when(fallback.chat(any())).thenReturn(answer("from fallback"));

        String text = router(fallback).complete(null, "hello", 0.2, 100);

        assertEquals("from fallback", text);
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(fallback).chat(request.capture());
        assertEquals("deepseek-chat", request.getValue().model());
        assertEquals(List.of(Message.user("hello")), request.getValue().messages());
    }

    @Test
    void withoutFallbackPrimaryFailurePropagates() {
        when(primary.chat(any())).thenThrow(new LlmClient.LlmRateLimitException("429"));

        assertThrows(LlmClient.LlmException.class, () -> router(null).complete(null, "hello", 0.2, 100));
    }

    @Test
    void bothProvidersFailing() {
        when(primary.chat(any())).thenThrow(new LlmClient.LlmException("primary down"));
        when(fallback.chat(any())).thenThrow(new LlmClient.LlmException("fallback down"));

        LlmClient.LlmException e = assertThrows(LlmClient.LlmException.class,
                () -> router(fallback).complete(null, "hello", 0.2, 100));
        assertTrue(e.getMessage().contains("fallback"));
    }
}
