package com.purchasingpower.newsgraph.embedding;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Gemini embeddings")
class GeminiEmbeddingProviderTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final List<ClientResponse> responses = new ArrayList<>();

    private NewsGraphProperties.Gemini settings;

    @BeforeEach
    void setUp() {
        settings = new NewsGraphProperties.Gemini();
        settings.setApiKey("test-key");
        settings.setMaxRetries(1);
        settings.setInitialBackoffSeconds(1);
        settings.setMaxBackoffSeconds(1);
    }

    @Test
    @DisplayName("Should call embedContent with the API key header and parse the values")
    void embedsText() {
        // Given
        responses.add(json(HttpStatus.OK, "{\"embedding\": {\"values\": [0.1, -0.2, 0.3]}}"));

        // When
        List<Double> vector = provider().embed("WAN 2.5 release notes");

        // Then
        assertEquals(List.of(0.1, -0.2, 0.3), vector);
        ClientRequest request = requests.get(0);
        assertEquals("/v1beta/models/text-embedding-004:embedContent", request.url().getPath());
        assertEquals("test-key", request.headers().getFirst("x-goog-api-key"));
        assertNull(request.url().getQuery(), "the key must not leak into the URL");
    }

    @Test
    @DisplayName("Should retry retryable status codes")
    void retriesServiceUnavailable() {
        // Given
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\": {\"message\": \"overloaded\"}}"));
        responses.add(json(HttpStatus.OK, "{\"embedding\": {\"values\": [1.0]}}"));

        // When
        List<Double> vector = provider().embed("text");

        // Then
        assertEquals(List.of(1.0), vector);
        assertEquals(2, requests.size());
    }

    @Test
    @DisplayName("Should not retry client errors")
    void clientErrorIsNotRetried() {
        // Given
        responses.add(json(HttpStatus.BAD_REQUEST, "{\"error\": {\"message\": \"API key not valid\"}}"));

        // When / Then
        assertThrows(EmbeddingUnavailableException.class, () -> provider().embed("text"));
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("Should treat a response without values as unavailable")
    void missingValues() {
        responses.add(json(HttpStatus.OK, "{\"embedding\": {}}"));

        assertThrows(EmbeddingUnavailableException.class, () -> provider().embed("text"));
    }

    @Test
    @DisplayName("Should request the dimension once")
    void requestsDimensionOnce() {
        // Given
        responses.add(json(HttpStatus.OK, "{\"embedding\": {\"values\": [0.1, 0.2, 0.3, 0.4]}}"));
        GeminiEmbeddingProvider provider = provider();

        // When
        provider.dimensions();

        // Then
        assertEquals(4, provider.dimensions());
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("Should require an API key")
    void requiresApiKey() {
        settings.setApiKey(" ");

        ConfigurationException ex = assertThrows(ConfigurationException.class, this::provider);
        assertEquals("newsgraph.embedding.gemini.api-key", ex.getProperty());
    }

    private GeminiEmbeddingProvider provider() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(responses.remove(0));
        });
        return new GeminiEmbeddingProvider(settings, builder);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }
}
