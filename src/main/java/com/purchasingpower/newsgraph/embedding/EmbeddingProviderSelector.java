package com.purchasingpower.newsgraph.embedding;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Picks the embedding provider once at startup.
 *
 * <p>The configured provider is built and asked for its dimension. When that call fails and hash fallback
 * is enabled, deterministic {@link HashEmbeddingProvider} embeddings are used instead and the reason is
 * logged. Configuration errors are never turned into a fallback.
 */
@Slf4j
public class EmbeddingProviderSelector {

    private final NewsGraphProperties.Embedding settings;
    private final Function<EmbeddingProviderType, EmbeddingProvider> factory;

    public EmbeddingProviderSelector(NewsGraphProperties.Embedding settings) {
        this(settings, type -> create(type, settings));
    }

    public EmbeddingProviderSelector(NewsGraphProperties.Embedding settings,
                                     Function<EmbeddingProviderType, EmbeddingProvider> factory) {
        this.settings = settings;
        this.factory = factory;
    }

    public EmbeddingProvider select() {
        EmbeddingProviderType type = settings.getProvider();
        try {
            EmbeddingProvider provider = factory.apply(type);
            int dimensions = provider.dimensions();
            log.info("✅ Using {} embeddings ({} dimensions)", provider.name(), dimensions);
            return provider;
        } catch (ConfigurationException e) {
            log.error("❌ Embedding provider {} is misconfigured: {}", type, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            if (!settings.isFallbackToHash() || type == EmbeddingProviderType.HASH) {
                throw e instanceof EmbeddingUnavailableException eu
                        ? eu
                        : new EmbeddingUnavailableException(type.name(), "Embedding provider dimension check failed", e);
            }
            HashEmbeddingProvider fallback = new HashEmbeddingProvider(settings.getHash().getDimensions());
            log.warn("⚠️  {} embeddings unavailable ({}). Falling back to deterministic {} embeddings.",
                    type, e.getMessage(), fallback.name());
            return fallback;
        }
    }

    static EmbeddingProvider create(EmbeddingProviderType type, NewsGraphProperties.Embedding settings) {
        return switch (type) {
            case GEMINI -> new GeminiEmbeddingProvider(settings.getGemini());
            case OLLAMA -> LangChain4jEmbeddingProvider.ollama(settings.getOllama());
            case HASH -> new HashEmbeddingProvider(settings.getHash().getDimensions());
        };
    }
}
