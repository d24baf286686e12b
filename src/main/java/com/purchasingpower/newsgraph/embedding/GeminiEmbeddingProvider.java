package com.purchasingpower.newsgraph.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException;
import com.purchasingpower.newsgraph.util.CallContext;
import com.purchasingpower.newsgraph.util.ExternalCallLogger;
import com.purchasingpower.newsgraph.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code embedContent} embeddings over {@link WebClient}.
 *
 * <p>The API key travels in the {@code x-goog-api-key} header, never in the URL.
 */
@Slf4j
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private final NewsGraphProperties.Gemini settings;
    private final WebClient webClient;
    private Integer dimensions;

    public GeminiEmbeddingProvider(NewsGraphProperties.Gemini settings) {
        this(settings, WebClient.builder());
    }

    GeminiEmbeddingProvider(NewsGraphProperties.Gemini settings, WebClient.Builder webClientBuilder) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new ConfigurationException("newsgraph.embedding.gemini.api-key",
                    "Gemini embeddings require an API key (GEMINI_API_KEY)");
        }
        if (settings.getModel() == null || settings.getModel().isBlank()) {
            throw new ConfigurationException("newsgraph.embedding.gemini.model",
                    "Gemini embeddings require a model name (GOOGLE_EMBEDDING_MODEL)");
        }
        this.settings = settings;
        this.webClient = webClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader("x-goog-api-key", settings.getApiKey())
                .build();
    }

    @Override
    public List<Double> embed(String text) {
        Preconditions.checkArgument(text != null && !text.isBlank(), "Text cannot be empty");

        String model = modelPath();
        CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "embedContent", log);
        call.logRequest("Embedding text", "Model", model, "Length", text.length());

        Map<String, Object> body = Map.of(
                "model", model,
                "content", Map.of("parts", List.of(Map.of("text", text))));

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(String.format("/%s/%s:embedContent", settings.getApiVersion(), model))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(buildRetrySpec())
                    .block();
        } catch (RuntimeException e) {
            call.logError("Gemini embedding request failed: " + e.getMessage(), e);
            throw new EmbeddingUnavailableException(name(), "Gemini embedding request failed", e);
        }

        JsonNode values = response == null ? null : response.path("embedding").path("values");
        if (values == null || !values.isArray() || values.isEmpty()) {
            call.logError("Gemini did not return an embedding", null);
            throw new EmbeddingUnavailableException(name(), "Gemini did not return an embedding");
        }

        List<Double> embedding = new ArrayList<>(values.size());
        values.forEach(value -> embedding.add(value.asDouble()));
        call.logResponse("Embedding generated", "Dimensions", embedding.size());
        return embedding;
    }

    @Override
    public int dimensions() {
        if (dimensions == null) {
            dimensions = embed(DIMENSION_SAMPLE).size();
            log.info("📐 {} produces {}-dimensional vectors", name(), dimensions);
        }
        return dimensions;
    }

    @Override
    public String name() {
        return "Gemini (" + settings.getModel() + ")";
    }

    private String modelPath() {
        String model = settings.getModel();
        return model.startsWith("models/") ? model : "models/" + model;
    }

    private Retry buildRetrySpec() {
        return Retry.backoff(settings.getMaxRetries(), Duration.ofSeconds(settings.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(settings.getMaxBackoffSeconds()))
                .filter(this::isRetryable);
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = settings.getRetryableStatusCodes();
        return codes != null && codes.contains(webEx.getStatusCode().value());
    }
}
