package com.openforge.taskcore.config;

import com.openforge.taskcore.embedding.EmbeddingClient;
import com.openforge.taskcore.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Programmatic Resilience4j wiring.
 *
 * Three named instances are pre-wired:
 *   • "primaryLlm"  — extraction model
 *   • "fallbackLlm" — secondary provider used when the primary circuit is open
 *   • "embedding"   — query / document embedding endpoint
 *
 * The LlmRouter tries primaryLlm first; if the circuit is OPEN it
 * falls through to fallbackLlm automatically.
 */
@Configuration
public class Resilience4jConfig {

    public static final String PRIMARY_LLM  = "primaryLlm";
    public static final String FALLBACK_LLM = "fallbackLlm";
    public static final String EMBEDDING    = "embedding";

    private static final List<String> INSTANCES = List.of(PRIMARY_LLM, FALLBACK_LLM, EMBEDDING);

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // a call slower than the longest provider timeout counts as a failure
                .slowCallDurationThreshold(Duration.ofSeconds(90))
                .slowCallRateThreshold(80)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        INSTANCES.forEach(registry::circuitBreaker);
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(PRIMARY_LLM);
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(FALLBACK_LLM);
    }

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(EMBEDDING);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2.0))
                .retryOnException(Resilience4jConfig::isTransient)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        INSTANCES.forEach(registry::retry);
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry(PRIMARY_LLM);
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry(FALLBACK_LLM);
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry(EMBEDDING);
    }

    /**
     * Network failures and 429s are worth another attempt; HTTP 4xx/5xx bodies
     * and parse failures are not.
     */
    static boolean isTransient(Throwable e) {
        if (e instanceof LlmClient.LlmRateLimitException
                || e instanceof EmbeddingClient.EmbeddingRateLimitException) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) return true;
        }
        return false;
    }
}
