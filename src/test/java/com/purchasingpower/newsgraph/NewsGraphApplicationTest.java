package com.purchasingpower.newsgraph;

import com.purchasingpower.newsgraph.embedding.EmbeddingProvider;
import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.pipeline.ScenarioOrchestrator;
import com.purchasingpower.newsgraph.scenario.ScenarioRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "newsgraph.graph.backends=IN_MEMORY",
        "newsgraph.embedding.provider=HASH",
        "newsgraph.embedding.hash.dimensions=32",
        "newsgraph.scenario.enabled=false"
})
@DisplayName("Application context")
class NewsGraphApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private KnowledgeGraphStore store;

    @Autowired
    private EmbeddingProvider embeddingProvider;

    @Test
    @DisplayName("Should wire the in-memory backend to the hash embeddings")
    void contextLoads() {
        assertNotNull(context.getBean(ScenarioOrchestrator.class));
        assertEquals(BackendType.IN_MEMORY, store.backendType());
        assertEquals(32, embeddingProvider.dimensions());
        assertEquals(32, store.dimensions());
        assertTrue(context.getBeansOfType(ScenarioRunner.class).isEmpty());
    }
}
