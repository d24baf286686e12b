package com.purchasingpower.newsgraph.graph;

import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.GraphStats;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import com.purchasingpower.newsgraph.model.SimilarityEdge;
import com.purchasingpower.newsgraph.model.TopicArticle;

import java.util.List;

/**
 * Article knowledge graph: articles linked to topics, entities and projects, plus SIMILAR_TO edges between
 * near-duplicates.
 *
 * <p>Every implementation returns the same results for the same sequence of calls, so callers program
 * against this interface only. Implementations ensure their schema at construction time and own exactly
 * one connection resource, released by {@link #close()}.
 *
 * <p>Any operation may throw {@link com.purchasingpower.newsgraph.exception.BackendUnavailableException}
 * or {@link com.purchasingpower.newsgraph.exception.QueryRejectedException}. Nothing is retried internally.
 *
 * @see BackendType
 * @see KnowledgeGraphBackendSelector
 */
public interface KnowledgeGraphStore extends AutoCloseable {

    String DEFAULT_PROJECT_TOPIC = "Vision-Language Models";
    String DEFAULT_TOPIC_MARKER = "Image Edit";

    // =========================================================================
    // Schema and writes
    // =========================================================================

    /**
     * Creates the article identity constraint and the cosine vector index if they are absent.
     * Safe to call repeatedly.
     */
    void ensureSchema();

    /**
     * Creates or replaces the scalar fields and embedding of an article, keyed by message id, and marks it
     * as ingested. Relations of an existing article are kept.
     *
     * @throws com.purchasingpower.newsgraph.exception.SchemaViolationException if the embedding length
     *                                                                          differs from {@link #dimensions()}
     */
    void upsertArticle(Article article, List<Double> embedding);

    /**
     * Merges the article's topics by name and links them with ABOUT. No-op for an empty list.
     */
    void attachTopics(Article article);

    /**
     * Merges the article's entities by name, overwrites their type and links them with MENTIONS.
     * No-op for an empty list.
     */
    void attachEntities(Article article);

    /**
     * Merges the article's projects by name (keeping a known description when the new one is absent),
     * links them with FEATURES and links each project to its topics with ABOUT. No-op for an empty list.
     */
    void attachProjects(Article article);

    /**
     * Upserts one SIMILAR_TO edge per match, updating score and last-checked time of existing edges.
     * Edges only point from the source to an article first ingested no later than it, and never reverse an
     * existing edge. Matches pointing at the source itself, at unknown articles or at articles ingested
     * after the source are skipped.
     *
     * @return the matches that now have an edge from the source, in input order
     */
    List<SimilarMatch> createSimilarityLinks(String sourceId, List<SimilarMatch> matches);

    // =========================================================================
    // Reads
    // =========================================================================

    /**
     * Articles whose embedding has a cosine similarity of at least {@code minScore} with the query,
     * never including {@code excludingId}, ordered by score descending then message id ascending.
     */
    List<SimilarMatch> findSimilarArticles(List<Double> embedding, String excludingId, int limit, double minScore);

    /**
     * Outgoing SIMILAR_TO edges of an article, ordered by score descending then target id ascending.
     */
    List<SimilarityEdge> findSimilarityLinks(String sourceId);

    /**
     * Articles published in the last {@code days} days with their topic names,
     * ordered by day descending then title ascending.
     */
    List<DigestEntry> weeklyDigest(int days);

    /**
     * Articles published in the last {@code days} days that mention the entity, newest first.
     */
    List<EntityArticle> articleListByEntity(String entityName, int days);

    /**
     * Projects about the topic, one row per article featuring them, newest article first.
     */
    List<ProjectArticle> vlmProjects(String topic);

    default List<ProjectArticle> vlmProjects() {
        return vlmProjects(DEFAULT_PROJECT_TOPIC);
    }

    /**
     * Articles with at least one topic containing {@code marker}, with the matching topic names,
     * ordered by day descending then title ascending.
     */
    List<TopicArticle> imageEditNews(String marker);

    default List<TopicArticle> imageEditNews() {
        return imageEditNews(DEFAULT_TOPIC_MARKER);
    }

    GraphStats stats();

    // =========================================================================
    // Metadata and lifecycle
    // =========================================================================

    BackendType backendType();

    /**
     * Vector length accepted by {@link #upsertArticle} and {@link #findSimilarArticles}.
     */
    int dimensions();

    /**
     * Releases the driver, HTTP client or in-memory state. Idempotent.
     */
    @Override
    void close();
}
