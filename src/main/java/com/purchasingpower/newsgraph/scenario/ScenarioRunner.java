package com.purchasingpower.newsgraph.scenario;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.pipeline.IngestionReport;
import com.purchasingpower.newsgraph.pipeline.QueryCatalogReport;
import com.purchasingpower.newsgraph.pipeline.ReportRenderer;
import com.purchasingpower.newsgraph.pipeline.ScenarioOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Ingests the configured dataset on startup, then logs the ingestion and query reports.
 */
@Slf4j
@RequiredArgsConstructor
public class ScenarioRunner implements CommandLineRunner {

    private final ScenarioOrchestrator orchestrator;
    private final KnowledgeGraphStore store;
    private final NewsGraphProperties.Scenario settings;
    private final ArticleBatchReader reader;
    private final Clock clock;

    @Override
    public void run(String... args) {
        List<Article> articles = loadArticles();
        log.info("🚀 Running {} scenario with {} article(s)", settings.getDataset(), articles.size());

        IngestionReport ingestion = orchestrator.ingest(articles);
        log.info("\n{}", ReportRenderer.render(ingestion));

        QueryCatalogReport queries = orchestrator.runQueryCatalog();
        log.info("\n{}", ReportRenderer.render(queries));
        log.info("Graph: {}", store.stats());
    }

    List<Article> loadArticles() {
        return switch (settings.getDataset()) {
            case SYNTHETIC -> SyntheticArticles.create(clock);
            case SIMILAR_PAIR -> SimilarPairArticles.create(clock);
            case FILE -> {
                if (settings.getInputFile() == null || settings.getInputFile().isBlank()) {
                    throw new ConfigurationException("newsgraph.scenario.input-file",
                            "The FILE dataset needs newsgraph.scenario.input-file");
                }
                yield reader.read(Path.of(settings.getInputFile()));
            }
        };
    }
}
