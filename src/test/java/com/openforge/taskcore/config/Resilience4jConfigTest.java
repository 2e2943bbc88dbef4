package com.openforge.taskcore.config;

import com.openforge.taskcore.embedding.EmbeddingClient;
import com.openforge.taskcore.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Resilience4jConfigTest {

    @Test
    void rateLimitsAndNetworkErrorsAreTransient() {
        assertTrue(Resilience4jConfig.isTransient(new LlmClient.LlmRateLimitException("429")));
        assertTrue(Resilience4jConfig.isTransient(new EmbeddingClient.EmbeddingRateLimitException("429")));
        assertTrue(Resilience4jConfig.isTransient(
                new LlmClient.LlmException("network", new HttpTimeoutException("timed out"))));
        assertTrue(Resilience4jConfig.isTransient(
                new EmbeddingClient.EmbeddingException("network", new IOException("reset"))));
    }

    @Test
    void httpErrorsAndParseFailuresAreNot() {
        assertFalse(Resilience4jConfig.isTransient(new LlmClient.LlmException("HTTP 400")));
        assertFalse(Resilience4jConfig.isTransient(new EmbeddingClient.EmbeddingException("bad json")));
        assertFalse(Resilience4jConfig.isTransient(new IllegalStateException("no choices")));
    }

    @Test
    void namedInstancesArePreRegistered() {
        Resilience4jConfig config = new Resilience4jConfig();
        CircuitBreakerRegistry breakers = config.circuitBreakerRegistry();
        RetryRegistry retries = config.retryRegistry();

        for (String name : List.of(Resilience4jConfig.PRIMARY_LLM, Resilience4jConfig.FALLBACK_LLM,
                Resilience4jConfig.EMBEDDING)) {
            assertTrue(breakers.find(name).isPresent(), name);
            assertTrue(retries.find(name).isPresent(), name);
        }
        assertEquals(3, config.embeddingRetry(retries).getRetryConfig().getMaxAttempts());
    }

    @Test
    void apiKeysAreMaskedInStartupSummary() {
        assertEquals("(not set)", StartupInfoRunner.maskKey(null));
        assertEquals("(not set)", StartupInfoRunner.maskKey("sk-placeholder"));
        assertEquals("***", StartupInfoRunner.maskKey("short"));
        assertEquals("sk-abc...wxyz", StartupInfoRunner.maskKey("sk-abcdefghijklmnopqrstuvwxyz"));
    }
}
