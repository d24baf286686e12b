package com.purchasingpower.newsgraph.graph.cypher;

import com.google.common.base.Preconditions;
import com.purchasingpower.newsgraph.exception.NewsGraphException;
import com.purchasingpower.newsgraph.exception.SchemaViolationException;
import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.EntityRef;
import com.purchasingpower.newsgraph.model.GraphStats;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.ProjectRef;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import com.purchasingpower.newsgraph.model.SimilarityEdge;
import com.purchasingpower.newsgraph.model.TopicArticle;
import com.purchasingpower.newsgraph.util.CallContext;
import com.purchasingpower.newsgraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Implements the store contract on top of {@link CypherStatements}; subclasses only supply the transport.
 *
 * <p>Subclasses acquire their connection in the constructor and then call {@link #initializeSchema()}.
 * It validates the index settings and creates the schema, and releases the connection again if either
 * fails, so a store that could not be constructed never holds a connection.
 */
@Slf4j
public abstract class AbstractCypherKnowledgeGraphStore implements KnowledgeGraphStore {

    private final int dimensions;
    private final String vectorIndexName;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected AbstractCypherKnowledgeGraphStore(int dimensions, String vectorIndexName, Clock clock) {
        this.dimensions = dimensions;
        this.vectorIndexName = vectorIndexName;
        this.clock = clock;
    }

    /**
     * Runs one statement and returns its rows as field-name maps in result order.
     */
    protected abstract List<Map<String, Object>> run(CypherStatement statement, Map<String, Object> parameters);

    /**
     * Releases the driver or client. Called at most once.
     */
    protected abstract void releaseResources();

    protected final void initializeSchema() {
        try {
            Preconditions.checkArgument(dimensions > 0, "dimensions must be positive: %s", dimensions);
            Preconditions.checkArgument(vectorIndexName != null && vectorIndexName.matches("\\w+"),
                    "vector index name must be a plain identifier: %s", vectorIndexName);
            ensureSchema();
        } catch (RuntimeException e) {
            try {
                close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public void ensureSchema() {
        execute(CypherStatements.ARTICLE_CONSTRAINT, Map.of());
        execute(CypherStatements.vectorIndex(vectorIndexName, dimensions), Map.of());
        execute(CypherStatements.AWAIT_INDEXES, Map.of());
        log.info("✅ {} schema ready: constraint on Article.messageId, vector index {} ({} dims, cosine)",
                backendType(), vectorIndexName, dimensions);
    }

    @Override
    public void upsertArticle(Article article, List<Double> embedding) {
        checkDimensions(embedding);
        Map<String, Object> params = new HashMap<>();
        params.put("messageId", article.getMessageId());
        params.put("title", article.getTitle());
        params.put("body", article.getBody());
        params.put("url", article.getUrl());
        params.put("sourceChannel", article.getSourceChannel());
        params.put("publishedAt", article.getPublishedAt().toString());
        params.put("embedding", embedding);
        params.put("ingestedAt", clock.instant().toString());
        execute(CypherStatements.UPSERT_ARTICLE, params);
    }

    @Override
    public void attachTopics(Article article) {
        List<String> topics = new ArrayList<>(new LinkedHashSet<>(article.getTopics()));
        if (topics.isEmpty()) {
            return;
        }
        execute(CypherStatements.ATTACH_TOPICS, Map.of("messageId", article.getMessageId(), "topics", topics));
    }

    @Override
    public void attachEntities(Article article) {
        if (article.getEntities().isEmpty()) {
            return;
        }
        List<Map<String, Object>> entities = new ArrayList<>();
        for (EntityRef entity : article.getEntities()) {
            Map<String, Object> value = new HashMap<>();
            value.put("name", entity.name());
            value.put("type", entity.type());
            entities.add(value);
        }
        execute(CypherStatements.ATTACH_ENTITIES, Map.of("messageId", article.getMessageId(), "entities", entities));
    }

    @Override
    public void attachProjects(Article article) {
        if (article.getProjects().isEmpty()) {
            return;
        }
        List<Map<String, Object>> projects = new ArrayList<>();
        for (ProjectRef project : article.getProjects()) {
            Map<String, Object> value = new HashMap<>();
            value.put("name", project.name());
            // null keeps a stored description through coalesce()
            value.put("description", project.description());
            value.put("topics", List.copyOf(new LinkedHashSet<>(project.topics())));
            projects.add(value);
        }
        execute(CypherStatements.ATTACH_PROJECTS, Map.of("messageId", article.getMessageId(), "projects", projects));
    }

    @Override
    public List<SimilarMatch> createSimilarityLinks(String sourceId, List<SimilarMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (SimilarMatch match : matches) {
            if (match.messageId().equals(sourceId)) {
                continue;
            }
            rows.add(Map.of("messageId", match.messageId(), "score", match.score()));
        }
        if (rows.isEmpty()) {
            return List.of();
        }
        Set<String> linked = new HashSet<>();
        for (Map<String, Object> row : execute(CypherStatements.CREATE_SIMILARITY_LINKS, Map.of(
                "sourceId", sourceId,
                "matches", rows,
                "checkedAt", clock.instant().toString()))) {
            linked.add((String) row.get("messageId"));
        }
        return matches.stream().filter(match -> linked.contains(match.messageId())).toList();
    }

    @Override
    public List<SimilarMatch> findSimilarArticles(List<Double> embedding, String excludingId, int limit,
                                                  double minScore) {
        checkDimensions(embedding);
        Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
        Map<String, Object> params = new HashMap<>();
        params.put("indexName", vectorIndexName);
        params.put("candidates", limit + 1);
        params.put("embedding", embedding);
        params.put("excludingId", excludingId == null ? "" : excludingId);
        params.put("minScore", minScore);
        params.put("limit", limit);
        return execute(CypherStatements.FIND_SIMILAR, params).stream()
                .map(CypherRowMapper::similarMatch)
                .toList();
    }

    @Override
    public List<SimilarityEdge> findSimilarityLinks(String sourceId) {
        return execute(CypherStatements.FIND_SIMILARITY_LINKS, Map.of("sourceId", sourceId)).stream()
                .map(CypherRowMapper::similarityEdge)
                .toList();
    }

    @Override
    public List<DigestEntry> weeklyDigest(int days) {
        Preconditions.checkArgument(days > 0, "days must be positive: %s", days);
        return execute(CypherStatements.WEEKLY_DIGEST, Map.of("days", days)).stream()
                .map(CypherRowMapper::digestEntry)
                .toList();
    }

    @Override
    public List<EntityArticle> articleListByEntity(String entityName, int days) {
        Preconditions.checkArgument(days > 0, "days must be positive: %s", days);
        return execute(CypherStatements.ARTICLES_BY_ENTITY, Map.of("entity", entityName, "days", days)).stream()
                .map(CypherRowMapper::entityArticle)
                .toList();
    }

    @Override
    public List<ProjectArticle> vlmProjects(String topic) {
        return execute(CypherStatements.PROJECTS_BY_TOPIC, Map.of("topic", topic)).stream()
                .map(CypherRowMapper::projectArticle)
                .toList();
    }

    @Override
    public List<TopicArticle> imageEditNews(String marker) {
        return execute(CypherStatements.ARTICLES_BY_TOPIC_MARKER, Map.of("marker", marker)).stream()
                .map(CypherRowMapper::topicArticle)
                .toList();
    }

    @Override
    public GraphStats stats() {
        List<Map<String, Object>> rows = execute(CypherStatements.STATS, Map.of());
        return CypherRowMapper.graphStats(rows.get(0));
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            releaseResources();
            log.info("{} store closed", backendType());
        }
    }

    protected Clock clock() {
        return clock;
    }

    private void checkDimensions(List<Double> embedding) {
        int actual = embedding == null ? 0 : embedding.size();
        if (actual != dimensions) {
            throw new SchemaViolationException(backendType(), dimensions, actual);
        }
    }

    private List<Map<String, Object>> execute(CypherStatement statement, Map<String, Object> parameters) {
        CallContext ctx = ExternalCallLogger.startCall(backendType().getServiceType(), statement.name(), log);
        ctx.logRequest(statement.mode().name(),
                "Parameters", ExternalCallLogger.formatParameters(new LinkedHashMap<>(parameters)));
        try {
            List<Map<String, Object>> rows = run(statement, parameters);
            ctx.logResponse(rows.size() + " rows");
            return rows;
        } catch (NewsGraphException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
