package com.purchasingpower.newsgraph.graph.neo4j;

import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Ownership of the driver when construction fails; runs without a database.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Neo4j Bolt store lifecycle")
class Neo4jBoltKnowledgeGraphStoreLifecycleTest {

    @Mock
    private Driver driver;

    @Test
    @DisplayName("Should close the driver when the dimension is not positive")
    void invalidDimensionClosesDriver() {
        // When
        assertThrows(IllegalArgumentException.class,
                () -> new Neo4jBoltKnowledgeGraphStore(driver, "neo4j", 0, "article_embedding_idx",
                        Clock.systemUTC()));

        // Then
        verify(driver).close();
        verifyNoMoreInteractions(driver);
    }

    @Test
    @DisplayName("Should close the driver when the index name is not a plain identifier")
    void invalidIndexNameClosesDriver() {
        // When
        assertThrows(IllegalArgumentException.class,
                () -> new Neo4jBoltKnowledgeGraphStore(driver, "neo4j", 256, "article-embedding-idx",
                        Clock.systemUTC()));

        // Then
        verify(driver).close();
        verifyNoMoreInteractions(driver);
    }

    @Test
    @DisplayName("Should close the driver when the schema cannot be created")
    void schemaFailureClosesDriver() {
        // Given
        when(driver.session(any(SessionConfig.class))).thenThrow(new ServiceUnavailableException("Connection refused"));

        // When
        assertThrows(BackendUnavailableException.class,
                () -> new Neo4jBoltKnowledgeGraphStore(driver, "neo4j", 256, "article_embedding_idx",
                        Clock.systemUTC()));

        // Then
        verify(driver).close();
    }
}
