package com.purchasingpower.newsgraph.graph.neo4j;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStoreContract;
import com.purchasingpower.newsgraph.graph.Neo4jContainerSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Neo4j Bolt knowledge graph")
class Neo4jBoltKnowledgeGraphStoreTest extends KnowledgeGraphStoreContract {

    @Override
    protected KnowledgeGraphStore createEmptyStore() {
        Neo4jContainerSupport.clearGraph();
        return new Neo4jBoltKnowledgeGraphStore(Neo4jContainerSupport.settings(), DIMENSIONS,
                "article_embedding_idx", Clock.systemUTC());
    }

    @Test
    @DisplayName("Should report the Bolt backend")
    void reportsBackendType() {
        assertEquals(BackendType.BOLT, store.backendType());
    }

    @Test
    @DisplayName("Should reject a vector index whose dimension differs from the existing one")
    void schemaMismatchIsRejectedOnQuery() {
        // Given: the 4-dimensional index already exists, IF NOT EXISTS keeps it
        KnowledgeGraphStore wide = new Neo4jBoltKnowledgeGraphStore(Neo4jContainerSupport.settings(), 8,
                "article_embedding_idx", Clock.systemUTC());

        // When / Then
        try (wide) {
            assertThrows(QueryRejectedException.class, () -> wide.findSimilarArticles(
                    Collections.nCopies(8, 0.5), "x", 3, 0.0));
        }
    }

    @Test
    @DisplayName("Should fail fast without credentials")
    void requiresCredentials() {
        NewsGraphProperties.Neo4j settings = Neo4jContainerSupport.settings();
        settings.setPassword(" ");

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> new Neo4jBoltKnowledgeGraphStore(settings, DIMENSIONS, "article_embedding_idx",
                        Clock.systemUTC()));
        assertEquals("newsgraph.neo4j.password", ex.getProperty());
    }

    @Test
    @DisplayName("Should report an unreachable server as unavailable")
    void unreachableServerIsUnavailable() {
        NewsGraphProperties.Neo4j settings = Neo4jContainerSupport.settings();
        settings.setUri("bolt://localhost:1");
        settings.setConnectionTimeoutSeconds(2);

        assertThrows(BackendUnavailableException.class,
                () -> new Neo4jBoltKnowledgeGraphStore(settings, DIMENSIONS, "article_embedding_idx",
                        Clock.systemUTC()));
    }
}
