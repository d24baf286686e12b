package com.purchasingpower.newsgraph.graph;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.graph.http.Neo4jQueryApiKnowledgeGraphStore;
import com.purchasingpower.newsgraph.graph.memory.InMemoryKnowledgeGraphStore;
import com.purchasingpower.newsgraph.graph.neo4j.Neo4jBoltKnowledgeGraphStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Walks the configured backend chain once at startup and returns the first store that comes up.
 *
 * <p>Each skipped backend is logged at WARN with its failure. A {@link ConfigurationException} stops the
 * chain immediately.
 */
@Slf4j
public class KnowledgeGraphBackendSelector {

    private final List<BackendType> chain;
    private final BiFunction<BackendType, Integer, KnowledgeGraphStore> factory;

    public KnowledgeGraphBackendSelector(NewsGraphProperties properties, Clock clock) {
        this(properties.getGraph().getBackends(), (type, dimensions) -> create(type, dimensions, properties, clock));
    }

    public KnowledgeGraphBackendSelector(List<BackendType> chain,
                                         BiFunction<BackendType, Integer, KnowledgeGraphStore> factory) {
        if (chain == null || chain.isEmpty()) {
            throw new ConfigurationException("newsgraph.graph.backends", "At least one graph backend is required");
        }
        this.chain = List.copyOf(chain);
        this.factory = factory;
    }

    public KnowledgeGraphStore select(int dimensions) {
        RuntimeException lastFailure = null;
        for (int i = 0; i < chain.size(); i++) {
            BackendType type = chain.get(i);
            try {
                KnowledgeGraphStore store = factory.apply(type, dimensions);
                log.info("✅ Using {} knowledge graph backend", type.getServiceType().getDisplayName());
                return store;
            } catch (ConfigurationException e) {
                log.error("❌ {} backend is misconfigured: {}", type, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                lastFailure = e;
                if (i + 1 < chain.size()) {
                    log.warn("⚠️  {} backend unavailable ({}). Falling back to {}.",
                            type, e.getMessage(), chain.get(i + 1));
                } else {
                    log.warn("⚠️  {} backend unavailable ({}). No backends left.", type, e.getMessage());
                }
            }
        }
        throw new BackendUnavailableException(chain.get(chain.size() - 1),
                "No knowledge graph backend available; tried " + chain, lastFailure);
    }

    static KnowledgeGraphStore create(BackendType type, int dimensions, NewsGraphProperties properties,
                                      Clock clock) {
        String indexName = properties.getGraph().getVectorIndexName();
        return switch (type) {
            case BOLT -> new Neo4jBoltKnowledgeGraphStore(properties.getNeo4j(), dimensions, indexName, clock);
            case QUERY_API -> new Neo4jQueryApiKnowledgeGraphStore(properties.getNeo4j(), dimensions, indexName,
                    clock);
            case IN_MEMORY -> new InMemoryKnowledgeGraphStore(dimensions, clock);
        };
    }
}
