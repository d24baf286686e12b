package com.purchasingpower.newsgraph.config;

import com.purchasingpower.newsgraph.detection.DetectionPolicy;
import com.purchasingpower.newsgraph.detection.DuplicateDetector;
import com.purchasingpower.newsgraph.embedding.EmbeddingProvider;
import com.purchasingpower.newsgraph.embedding.EmbeddingProviderSelector;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphBackendSelector;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.pipeline.IdempotentWriteRetrier;
import com.purchasingpower.newsgraph.pipeline.ScenarioOrchestrator;
import com.purchasingpower.newsgraph.scenario.ArticleBatchReader;
import com.purchasingpower.newsgraph.scenario.ScenarioRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pipeline from {@link NewsGraphProperties}.
 *
 * <p>The embedding provider is selected first because its dimension fixes the vector index of the graph
 * backend. Both selections happen once, at context startup.
 */
@Configuration
@EnableConfigurationProperties(NewsGraphProperties.class)
public class KnowledgeGraphConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(NewsGraphProperties properties) {
        return new EmbeddingProviderSelector(properties.getEmbedding()).select();
    }

    @Bean(destroyMethod = "close")
    public KnowledgeGraphStore knowledgeGraphStore(NewsGraphProperties properties,
                                                   EmbeddingProvider embeddingProvider,
                                                   Clock clock) {
        return new KnowledgeGraphBackendSelector(properties, clock).select(embeddingProvider.dimensions());
    }

    @Bean
    public DuplicateDetector duplicateDetector(KnowledgeGraphStore store, NewsGraphProperties properties) {
        NewsGraphProperties.Detection detection = properties.getDetection();
        return new DuplicateDetector(store, new DetectionPolicy(detection.getMinScore(), detection.getLimit()));
    }

    @Bean
    public IdempotentWriteRetrier idempotentWriteRetrier(NewsGraphProperties properties) {
        return new IdempotentWriteRetrier(properties.getRetry());
    }

    @Bean
    public ScenarioOrchestrator scenarioOrchestrator(KnowledgeGraphStore store,
                                                     EmbeddingProvider embeddingProvider,
                                                     DuplicateDetector duplicateDetector,
                                                     IdempotentWriteRetrier retrier,
                                                     NewsGraphProperties properties) {
        return new ScenarioOrchestrator(store, embeddingProvider, duplicateDetector, retrier,
                properties.getPipeline());
    }

    @Bean
    public ArticleBatchReader articleBatchReader() {
        return new ArticleBatchReader();
    }

    @Bean
    @ConditionalOnProperty(prefix = "newsgraph.scenario", name = "enabled", havingValue = "true")
    public ScenarioRunner scenarioRunner(ScenarioOrchestrator orchestrator,
                                         KnowledgeGraphStore store,
                                         NewsGraphProperties properties,
                                         ArticleBatchReader articleBatchReader,
                                         Clock clock) {
        return new ScenarioRunner(orchestrator, store, properties.getScenario(), articleBatchReader, clock);
    }
}
