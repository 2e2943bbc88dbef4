package com.openforge.taskcore.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskcore.llm.model.ChatRequest;
import com.openforge.taskcore.llm.model.ChatResponse;
import com.openforge.taskcore.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * High-availability LLM request router.
 *
 * Call graph:
 *
 *   chat(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.chat(request)
 *
 * The fallback provider is optional; without it the primary failure is rethrown.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.hasFallback()
                        ? new LlmClient(httpClient, objectMapper, properties.fallback())
                        : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Route a chat request through primary → fallback with full resilience.
     *
     * The model field in ChatRequest is overridden by the provider's own
     * configured model name, so callers only need to pass the message list.
     */
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = request.toBuilder().model(primaryClient.modelName()).build();
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) throw primaryException;
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    /**
     * Single-prompt completion returning the raw text of the first choice.
     *
     * @param systemPrompt    instructions, may be null
     * @param prompt          user prompt
     * @param temperature     sampling temperature
     * @param maxOutputTokens output cap
     */
    public String complete(String systemPrompt, String prompt, double temperature, int maxOutputTokens) {
        List<Message> messages = systemPrompt == null
                ? List.of(Message.user(prompt))
                : List.of(Message.system(systemPrompt), Message.user(prompt));
        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .temperature(temperature)
                .maxTokens(maxOutputTokens)
                .build();
        return chat(request).firstContent();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic — no AOP proxies, no annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
