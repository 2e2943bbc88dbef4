package com.openforge.taskcore.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Embedding client for the OpenAI-compatible /embeddings endpoint.
 *
 * Raw HttpClient + Jackson, wrapped in the "embedding" circuit breaker and retry.
 * The mode only selects the configured input prefix; the endpoint itself is
 * mode-agnostic.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient implements EmbeddingService {

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;
    private final CircuitBreaker      circuitBreaker;
    private final Retry               retry;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props,
                           CircuitBreaker embeddingCircuitBreaker,
                           Retry embeddingRetry) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.props          = props;
        this.circuitBreaker = embeddingCircuitBreaker;
        this.retry          = embeddingRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Embed a piece of text and return the float vector.
     *
     * @param text the text to embed (truncated to a safe length first)
     * @param mode query or document side of the retrieval pair
     * @return float vector, length = {@link EmbeddingProperties#dimensions()}
     */
    @Override
    public List<Float> embed(String text, EmbeddingMode mode) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }

        EmbeddingRequest request = EmbeddingRequest.forMode(text, mode, props);
        String body = serialize(request);

        log.debug("[Embed] → POST /embeddings model={} mode={} input-length={}",
                props.model(), mode, request.input().length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        Supplier<List<Float>> call = () -> parseResponse(send(httpRequest));
        return CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, call)).get();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        }
    }

    private List<Float> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingRateLimitException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            List<Float> vector = resp.vector(props.dimensions());
            log.debug("[Embed] ← vector dim={} prompt-tokens={}", vector.size(), resp.promptTokens());
            return vector;
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Failed to read embedding response: " + e.getMessage(), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }

    public static class EmbeddingRateLimitException extends EmbeddingException {
        public EmbeddingRateLimitException(String message) { super(message); }
    }
}
