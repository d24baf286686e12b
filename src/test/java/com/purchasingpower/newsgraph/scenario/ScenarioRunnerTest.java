package com.purchasingpower.newsgraph.scenario;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.pipeline.IngestionReport;
import com.purchasingpower.newsgraph.pipeline.QueryCatalogReport;
import com.purchasingpower.newsgraph.pipeline.ScenarioOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Scenario runner")
class ScenarioRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-24T09:20:00Z"), ZoneOffset.UTC);

    @Mock
    private ScenarioOrchestrator orchestrator;

    @Mock
    private KnowledgeGraphStore store;

    private NewsGraphProperties.Scenario settings;
    private ScenarioRunner runner;

    @BeforeEach
    void setUp() {
        settings = new NewsGraphProperties.Scenario();
        runner = new ScenarioRunner(orchestrator, store, settings, new ArticleBatchReader(), CLOCK);
    }

    @Test
    @DisplayName("Should load the six synthetic articles by default")
    void syntheticDataset() {
        List<Article> articles = runner.loadArticles();

        assertEquals(6, articles.size());
        assertEquals("tg-1001", articles.get(0).getMessageId());
    }

    @Test
    @DisplayName("Should load the similar pair five minutes apart")
    void similarPairDataset() {
        // Given
        settings.setDataset(ScenarioDataset.SIMILAR_PAIR);

        // When
        List<Article> articles = runner.loadArticles();

        // Then
        assertEquals(List.of("1719", "1720"), articles.stream().map(Article::getMessageId).toList());
        assertEquals(CLOCK.instant(), articles.get(1).getPublishedAt());
    }

    @Test
    @DisplayName("Should require an input file for the FILE dataset")
    void fileDatasetNeedsPath() {
        // Given
        settings.setDataset(ScenarioDataset.FILE);

        // When
        ConfigurationException ex = assertThrows(ConfigurationException.class, runner::loadArticles);

        // Then
        assertEquals("newsgraph.scenario.input-file", ex.getProperty());
    }

    @Test
    @DisplayName("Should ingest the dataset and run the query catalog")
    void runsPipeline() {
        // Given
        when(orchestrator.ingest(anyList())).thenReturn(new IngestionReport(null, "Stub", List.of(), 0));
        when(orchestrator.runQueryCatalog()).thenReturn(QueryCatalogReport.builder()
                .digestDays(7).digest(List.of())
                .entityName("OpenAI").entityDays(14).entityArticles(List.of())
                .projectTopic("Vision-Language Models").projects(List.of())
                .topicMarker("Image Edit").topicArticles(List.of())
                .build());

        // When
        runner.run();

        // Then
        verify(orchestrator).ingest(anyList());
        verify(orchestrator).runQueryCatalog();
        verify(store).stats();
    }
}
