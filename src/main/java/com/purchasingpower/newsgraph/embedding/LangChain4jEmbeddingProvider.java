package com.purchasingpower.newsgraph.embedding;

import com.google.common.base.Preconditions;
import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException;
import com.purchasingpower.newsgraph.util.CallContext;
import com.purchasingpower.newsgraph.util.ExternalCallLogger;
import com.purchasingpower.newsgraph.util.ServiceType;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings through a LangChain4j {@link EmbeddingModel}; Ollama by default.
 *
 * <p>LangChain4j handles timeouts and retries of the underlying HTTP calls. The vector length is
 * discovered with a single sample call and cached.
 */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final ServiceType serviceType;
    private Integer dimensions;

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, String modelName, ServiceType serviceType) {
        this.embeddingModel = Preconditions.checkNotNull(embeddingModel, "embeddingModel");
        this.modelName = modelName;
        this.serviceType = serviceType;
    }

    public static LangChain4jEmbeddingProvider ollama(NewsGraphProperties.Ollama settings) {
        log.info("🔷 Initializing Ollama embeddings via LangChain4j");
        log.info("   - Ollama URL: {}", settings.getBaseUrl());
        log.info("   - Model: {}", settings.getModel());
        log.info("   - Timeout: {}s, max retries: {}", settings.getTimeoutSeconds(), settings.getMaxRetries());

        EmbeddingModel model = OllamaEmbeddingModel.builder()
                .baseUrl(settings.getBaseUrl())
                .modelName(settings.getModel())
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .maxRetries(settings.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
        return new LangChain4jEmbeddingProvider(model, settings.getModel(), ServiceType.OLLAMA);
    }

    @Override
    public List<Double> embed(String text) {
        Preconditions.checkArgument(text != null && !text.isBlank(), "Text cannot be empty");

        CallContext call = ExternalCallLogger.startCall(serviceType, "embed", log);
        call.logRequest("Embedding text", "Model", modelName, "Length", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            if (response == null || response.content() == null || response.content().vector().length == 0) {
                throw new EmbeddingUnavailableException(name(), modelName + " returned no embedding");
            }
            List<Double> embedding = toDoubleList(response.content());
            call.logResponse("Embedding generated", "Dimensions", embedding.size());
            return embedding;
        } catch (EmbeddingUnavailableException e) {
            call.logError(e.getMessage(), null);
            throw e;
        } catch (RuntimeException e) {
            call.logError("Embedding failed after retries: " + e.getMessage(), e);
            throw new EmbeddingUnavailableException(name(), "Embedding generation failed with " + modelName, e);
        }
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
        return serviceType.getDisplayName() + " (" + modelName + ")";
    }

    private List<Double> toDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
