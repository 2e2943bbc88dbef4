package com.openforge.taskcore.embedding;

import com.openforge.taskcore.config.AppConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EmbeddingClientTest {

    private static final String OK_BODY =
            "{\"object\":\"list\",\"data\":[{\"object\":\"embedding\",\"index\":0,\"embedding\":[0.25,-0.5]}],"
                    + "\"model\":\"text-embedding-3-small\",\"usage\":{\"prompt_tokens\":3,\"total_tokens\":3}}";

    private HttpClient httpClient;
    private EmbeddingClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        EmbeddingProperties props = new EmbeddingProperties(
                "https://embed.example.com/v1", "sk-test", "text-embedding-3-small", 2, 5, "query: ", "passage: ", false);
        Retry retry = Retry.of("embedding-test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(e -> e instanceof EmbeddingClient.EmbeddingRateLimitException)
                .build());
        client = new EmbeddingClient(httpClient, new AppConfig().objectMapper(), props,
                CircuitBreaker.ofDefaults("embedding-test"), retry);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @Test
    void returnsFirstEmbeddingVector() throws Exception {
        doReturn(response(200, OK_BODY)).when(httpClient).send(any(), any());

        List<Float> vector = client.embed("invoice report", EmbeddingMode.QUERY);

        assertEquals(List.of(0.25f, -0.5f), vector);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals("https://embed.example.com/v1/embeddings", request.getValue().uri().toString());
        assertEquals("Bearer sk-test", request.getValue().headers().firstValue("Authorization").orElseThrow());
    }

    @Test
    void rateLimitIsRetried() throws Exception {
        HttpResponse<String> limited = response(429, "{}");
        HttpResponse<String> ok = response(200, OK_BODY);
        doReturn(limited).doReturn(ok).when(httpClient).send(any(), any());

        assertEquals(2, client.embed("invoice report", EmbeddingMode.DOCUMENT).size());
        verify(httpClient, times(2)).send(any(), any());
    }

    @Test
    void serverErrorSurfacesAsEmbeddingException() throws Exception {
        doReturn(response(500, "boom")).when(httpClient).send(any(), any());

        assertThrows(EmbeddingClient.EmbeddingException.class,
                () -> client.embed("invoice report", EmbeddingMode.QUERY));
    }

    @Test
    void networkFailureIsWrapped() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

        EmbeddingClient.EmbeddingException e = assertThrows(EmbeddingClient.EmbeddingException.class,
                () -> client.embed("invoice report", EmbeddingMode.QUERY));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void emptyDataIsAnError() throws Exception {
        doReturn(response(200, "{\"data\":[]}")).when(httpClient).send(any(), any());

        assertThrows(EmbeddingClient.EmbeddingException.class,
                () -> client.embed("invoice report", EmbeddingMode.QUERY));
    }

    @Test
    void dimensionMismatchIsAnError() throws Exception {
        doReturn(response(200, "{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2,0.3]}]}"))
                .when(httpClient).send(any(), any());

        assertThrows(EmbeddingClient.EmbeddingException.class,
                () -> client.embed("invoice report", EmbeddingMode.QUERY));
    }

    @Test
    void blankTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> client.embed(" ", EmbeddingMode.QUERY));
    }

    @Test
    void prefixesDependOnMode() {
        EmbeddingProperties props = new EmbeddingProperties(null, null, "m", 2, 5, "query: ", null, false);

        assertEquals("query: ", props.prefixFor(EmbeddingMode.QUERY));
        assertEquals("", props.prefixFor(EmbeddingMode.DOCUMENT));
    }
}
