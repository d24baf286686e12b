package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.detection.DetectionPolicy;
import com.purchasingpower.newsgraph.detection.DuplicateDetector;
import com.purchasingpower.newsgraph.embedding.EmbeddingProvider;
import com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch of articles through embedding, graph writes and duplicate detection, then the query catalog.
 *
 * <p>Articles are processed one after another. The embedding is computed before anything is written, so
 * an embedding failure leaves no trace in the graph. Per-article failures are recorded and the batch moves
 * on; a backend that stays unavailable after retries aborts the whole run.
 */
@Slf4j
public class ScenarioOrchestrator {

    private final KnowledgeGraphStore store;
    private final EmbeddingProvider embeddingProvider;
    private final DuplicateDetector detector;
    private final IdempotentWriteRetrier retrier;
    private final NewsGraphProperties.Pipeline settings;
    private final DetectionPolicy duplicatePolicy;

    public ScenarioOrchestrator(KnowledgeGraphStore store,
                                EmbeddingProvider embeddingProvider,
                                DuplicateDetector detector,
                                IdempotentWriteRetrier retrier,
                                NewsGraphProperties.Pipeline settings) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.detector = detector;
        this.retrier = retrier;
        this.settings = settings;
        this.duplicatePolicy = new DetectionPolicy(settings.getDuplicateThreshold(), settings.getDuplicateLimit());
    }

    public IngestionReport ingest(List<Article> articles) {
        long startTime = System.currentTimeMillis();
        log.info("📥 Ingesting {} article(s) into {} with {} embeddings",
                articles.size(), store.backendType(), embeddingProvider.name());

        List<IngestionOutcome> outcomes = new ArrayList<>(articles.size());
        for (Article article : articles) {
            outcomes.add(ingestOne(article));
        }

        IngestionReport report = new IngestionReport(store.backendType(), embeddingProvider.name(), outcomes,
                System.currentTimeMillis() - startTime);
        log.info("✅ Ingestion finished: {} ingested, {} failed, {} duplicate link(s) in {}ms",
                report.ingestedCount(), report.failedCount(), report.duplicateLinkCount(), report.durationMs());
        return report;
    }

    public QueryCatalogReport runQueryCatalog() {
        return QueryCatalogReport.builder()
                .digestDays(settings.getDigestDays())
                .digest(store.weeklyDigest(settings.getDigestDays()))
                .entityName(settings.getEntityName())
                .entityDays(settings.getEntityDays())
                .entityArticles(store.articleListByEntity(settings.getEntityName(), settings.getEntityDays()))
                .projectTopic(settings.getProjectTopic())
                .projects(store.vlmProjects(settings.getProjectTopic()))
                .topicMarker(settings.getTopicMarker())
                .topicArticles(store.imageEditNews(settings.getTopicMarker()))
                .build();
    }

    private IngestionOutcome ingestOne(Article article) {
        String id = article.getMessageId();
        try {
            List<Double> embedding = embeddingProvider.embed(article.embeddingInput());

            retrier.run("upsertArticle " + id, () -> store.upsertArticle(article, embedding));
            retrier.run("attachTopics " + id, () -> store.attachTopics(article));
            retrier.run("attachEntities " + id, () -> store.attachEntities(article));
            retrier.run("attachProjects " + id, () -> store.attachProjects(article));
            List<SimilarMatch> duplicates = retrier.call("detectDuplicates " + id,
                    () -> detector.detect(id, embedding, duplicatePolicy));

            if (!duplicates.isEmpty()) {
                log.info("  Potential duplicates for '{}': {}", article.getTitle(),
                        duplicates.stream().map(SimilarMatch::messageId).toList());
            }
            return IngestionOutcome.ingested(id, article.getTitle(), duplicates);
        } catch (EmbeddingUnavailableException e) {
            log.warn("⚠️  Skipping {}: embedding unavailable ({})", id, e.getMessage());
            return IngestionOutcome.failed(id, article.getTitle(), "Embedding unavailable: " + e.getMessage());
        } catch (QueryRejectedException e) {
            log.warn("⚠️  Skipping {}: {} rejected the write ({})", id, e.getBackend(), e.getMessage());
            return IngestionOutcome.failed(id, article.getTitle(), "Query rejected: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("⚠️  Skipping {}: invalid input ({})", id, e.getMessage());
            return IngestionOutcome.failed(id, article.getTitle(), "Invalid input: " + e.getMessage());
        }
    }
}
