package com.purchasingpower.newsgraph.graph;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.memory.InMemoryKnowledgeGraphStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Knowledge graph backend selection")
class KnowledgeGraphBackendSelectorTest {

    private final List<BackendType> attempts = new ArrayList<>();

    @Test
    @DisplayName("Should fall through Bolt and Query API to the in-memory store")
    void fallsBackInOrder() {
        // Given
        KnowledgeGraphBackendSelector selector = new KnowledgeGraphBackendSelector(
                List.of(BackendType.BOLT, BackendType.QUERY_API, BackendType.IN_MEMORY),
                (type, dimensions) -> {
                    attempts.add(type);
                    return switch (type) {
                        case BOLT -> throw new BackendUnavailableException(type, "connection refused");
                        case QUERY_API -> throw new QueryRejectedException(type, "HTTP 403", "forbidden");
                        case IN_MEMORY -> new InMemoryKnowledgeGraphStore(dimensions);
                    };
                });

        // When
        KnowledgeGraphStore store = selector.select(8);

        // Then
        assertEquals(List.of(BackendType.BOLT, BackendType.QUERY_API, BackendType.IN_MEMORY), attempts);
        assertEquals(BackendType.IN_MEMORY, store.backendType());
        assertEquals(8, store.dimensions());
    }

    @Test
    @DisplayName("Should stop at the first backend that comes up")
    void stopsAtFirstSuccess() {
        // Given
        InMemoryKnowledgeGraphStore first = new InMemoryKnowledgeGraphStore(4);
        KnowledgeGraphBackendSelector selector = new KnowledgeGraphBackendSelector(
                List.of(BackendType.IN_MEMORY, BackendType.BOLT),
                (type, dimensions) -> {
                    attempts.add(type);
                    return first;
                });

        // When / Then
        assertSame(first, selector.select(4));
        assertEquals(List.of(BackendType.IN_MEMORY), attempts);
    }

    @Test
    @DisplayName("Should not fall back on configuration errors")
    void configurationErrorIsFatal() {
        // Given
        KnowledgeGraphBackendSelector selector = new KnowledgeGraphBackendSelector(
                List.of(BackendType.BOLT, BackendType.IN_MEMORY),
                (type, dimensions) -> {
                    attempts.add(type);
                    throw new ConfigurationException("newsgraph.neo4j.uri", "missing");
                });

        // When / Then
        assertThrows(ConfigurationException.class, () -> selector.select(4));
        assertEquals(List.of(BackendType.BOLT), attempts);
    }

    @Test
    @DisplayName("Should report unavailability when every backend fails")
    void allBackendsFail() {
        // Given
        BackendUnavailableException last = new BackendUnavailableException(BackendType.QUERY_API, "timeout");
        KnowledgeGraphBackendSelector selector = new KnowledgeGraphBackendSelector(
                List.of(BackendType.BOLT, BackendType.QUERY_API),
                (type, dimensions) -> {
                    throw type == BackendType.BOLT
                            ? new BackendUnavailableException(type, "refused")
                            : last;
                });

        // When
        BackendUnavailableException ex = assertThrows(BackendUnavailableException.class, () -> selector.select(4));

        // Then
        assertSame(last, ex.getCause());
        assertTrue(ex.getMessage().contains("BOLT"));
    }

    @Test
    @DisplayName("Should surface missing Neo4j settings from the real factory")
    void realFactoryRequiresNeo4jSettings() {
        // Given
        NewsGraphProperties properties = new NewsGraphProperties();

        // When
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> new KnowledgeGraphBackendSelector(properties, Clock.systemUTC()).select(4));

        // Then
        assertEquals("newsgraph.neo4j.uri", ex.getProperty());
    }

    @Test
    @DisplayName("Should build the in-memory store from properties")
    void realFactoryBuildsInMemoryStore() {
        // Given
        NewsGraphProperties properties = new NewsGraphProperties();
        properties.getGraph().setBackends(List.of(BackendType.IN_MEMORY));

        // When
        KnowledgeGraphStore store = new KnowledgeGraphBackendSelector(properties, Clock.systemUTC()).select(16);

        // Then
        assertEquals(BackendType.IN_MEMORY, store.backendType());
        assertEquals(16, store.dimensions());
    }

    @Test
    @DisplayName("Should reject an empty chain")
    void emptyChainIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> new KnowledgeGraphBackendSelector(List.of(), (type, dimensions) -> null));
    }
}
