package com.purchasingpower.newsgraph.graph.memory;

import com.google.common.base.Preconditions;
import com.purchasingpower.newsgraph.exception.SchemaViolationException;
import com.purchasingpower.newsgraph.graph.BackendType;
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
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-local article graph used when no Neo4j backend can be reached.
 *
 * <p>Mirrors the Cypher statements: nodes are merged by name, relations are sets, similarity search is a
 * linear cosine scan with the same threshold, ordering and self-exclusion rules. Not thread-safe.
 */
@Slf4j
public class InMemoryKnowledgeGraphStore implements KnowledgeGraphStore {

    private final int dimensions;
    private final Clock clock;

    private final Map<String, StoredArticle> articles = new LinkedHashMap<>();
    private final Map<String, Instant> topics = new HashMap<>();
    private final Map<String, EntityNode> entities = new HashMap<>();
    private final Map<String, ProjectNode> projects = new HashMap<>();

    private final Set<Link> articleTopics = new LinkedHashSet<>();
    private final Set<Link> articleEntities = new LinkedHashSet<>();
    private final Set<Link> articleProjects = new LinkedHashSet<>();
    private final Set<Link> projectTopics = new LinkedHashSet<>();
    private final Map<Link, SimilarityEdge> similarityEdges = new LinkedHashMap<>();
    private long nextIngestion;

    public InMemoryKnowledgeGraphStore(int dimensions) {
        this(dimensions, Clock.systemUTC());
    }

    public InMemoryKnowledgeGraphStore(int dimensions, Clock clock) {
        Preconditions.checkArgument(dimensions > 0, "dimensions must be positive: %s", dimensions);
        this.dimensions = dimensions;
        this.clock = clock;
        ensureSchema();
    }

    @Override
    public void ensureSchema() {
        log.info("✅ In-memory graph ready ({} dims, cosine)", dimensions);
    }

    @Override
    public void upsertArticle(Article article, List<Double> embedding) {
        checkDimensions(embedding);
        StoredArticle previous = articles.get(article.getMessageId());
        long ingestion = previous != null ? previous.ingestion() : nextIngestion++;
        articles.put(article.getMessageId(), new StoredArticle(article, List.copyOf(embedding), ingestion));
    }

    @Override
    public void attachTopics(Article article) {
        String articleId = article.getMessageId();
        if (article.getTopics().isEmpty() || !articles.containsKey(articleId)) {
            return;
        }
        for (String topic : article.getTopics()) {
            mergeTopic(topic);
            articleTopics.add(new Link(articleId, topic));
        }
    }

    @Override
    public void attachEntities(Article article) {
        String articleId = article.getMessageId();
        if (article.getEntities().isEmpty() || !articles.containsKey(articleId)) {
            return;
        }
        for (EntityRef entity : article.getEntities()) {
            EntityNode node = entities.computeIfAbsent(entity.name(), name -> new EntityNode(clock.instant()));
            node.type = entity.type();
            articleEntities.add(new Link(articleId, entity.name()));
        }
    }

    @Override
    public void attachProjects(Article article) {
        String articleId = article.getMessageId();
        if (article.getProjects().isEmpty() || !articles.containsKey(articleId)) {
            return;
        }
        for (ProjectRef project : article.getProjects()) {
            ProjectNode node = projects.computeIfAbsent(project.name(), name -> new ProjectNode(clock.instant()));
            if (project.description() != null) {
                node.description = project.description();
            }
            articleProjects.add(new Link(articleId, project.name()));
            for (String topic : project.topics()) {
                mergeTopic(topic);
                projectTopics.add(new Link(project.name(), topic));
            }
        }
    }

    @Override
    public List<SimilarMatch> createSimilarityLinks(String sourceId, List<SimilarMatch> matches) {
        StoredArticle source = articles.get(sourceId);
        if (matches == null || matches.isEmpty() || source == null) {
            return List.of();
        }
        Instant checkedAt = clock.instant();
        List<SimilarMatch> linked = new ArrayList<>();
        for (SimilarMatch match : matches) {
            StoredArticle target = articles.get(match.messageId());
            if (target == null || match.messageId().equals(sourceId)
                    || target.ingestion() > source.ingestion()
                    || similarityEdges.containsKey(new Link(match.messageId(), sourceId))) {
                continue;
            }
            Link key = new Link(sourceId, match.messageId());
            similarityEdges.put(key, new SimilarityEdge(sourceId, match.messageId(), match.score(), checkedAt));
            linked.add(match);
        }
        return linked;
    }

    @Override
    public List<SimilarMatch> findSimilarArticles(List<Double> embedding, String excludingId, int limit,
                                                  double minScore) {
        checkDimensions(embedding);
        Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
        List<SimilarMatch> matches = new ArrayList<>();
        for (StoredArticle stored : articles.values()) {
            if (stored.messageId().equals(excludingId)) {
                continue;
            }
            Double score = cosine(embedding, stored.embedding());
            if (score != null && score >= minScore) {
                matches.add(new SimilarMatch(stored.messageId(), stored.article().getTitle(),
                        stored.article().getUrl(), score));
            }
        }
        return matches.stream()
                .sorted(Comparator.comparingDouble(SimilarMatch::score).reversed()
                        .thenComparing(SimilarMatch::messageId))
                .limit(limit)
                .toList();
    }

    @Override
    public List<SimilarityEdge> findSimilarityLinks(String sourceId) {
        return similarityEdges.values().stream()
                .filter(edge -> edge.sourceId().equals(sourceId))
                .sorted(Comparator.comparingDouble(SimilarityEdge::score).reversed()
                        .thenComparing(SimilarityEdge::targetId))
                .toList();
    }

    @Override
    public List<DigestEntry> weeklyDigest(int days) {
        Preconditions.checkArgument(days > 0, "days must be positive: %s", days);
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return articles.values().stream()
                .filter(stored -> !stored.publishedAt().isBefore(since))
                .map(stored -> new DigestEntry(stored.day(), stored.article().getTitle(),
                        stored.article().getUrl(), topicsOf(stored.messageId(), "")))
                .sorted(Comparator.comparing(DigestEntry::day).reversed()
                        .thenComparing(DigestEntry::title))
                .toList();
    }

    @Override
    public List<EntityArticle> articleListByEntity(String entityName, int days) {
        Preconditions.checkArgument(days > 0, "days must be positive: %s", days);
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return articles.values().stream()
                .filter(stored -> articleEntities.contains(new Link(stored.messageId(), entityName)))
                .filter(stored -> !stored.publishedAt().isBefore(since))
                .sorted(Comparator.comparing(StoredArticle::publishedAt).reversed()
                        .thenComparing(stored -> stored.article().getTitle()))
                .map(stored -> new EntityArticle(stored.article().getTitle(), stored.article().getUrl(),
                        stored.day()))
                .toList();
    }

    @Override
    public List<ProjectArticle> vlmProjects(String topic) {
        List<ProjectRow> rows = new ArrayList<>();
        for (Link feature : articleProjects) {
            if (!projectTopics.contains(new Link(feature.to(), topic))) {
                continue;
            }
            StoredArticle stored = articles.get(feature.from());
            rows.add(new ProjectRow(stored.publishedAt(), new ProjectArticle(feature.to(),
                    stored.article().getTitle(), stored.article().getUrl(), stored.day())));
        }
        return rows.stream()
                .sorted(Comparator.comparing(ProjectRow::publishedAt).reversed()
                        .thenComparing(row -> row.article().project())
                        .thenComparing(row -> row.article().title()))
                .map(ProjectRow::article)
                .toList();
    }

    @Override
    public List<TopicArticle> imageEditNews(String marker) {
        List<TopicArticle> rows = new ArrayList<>();
        for (StoredArticle stored : articles.values()) {
            List<String> matching = topicsOf(stored.messageId(), marker);
            if (!matching.isEmpty()) {
                rows.add(new TopicArticle(stored.article().getTitle(), stored.article().getUrl(),
                        stored.day(), matching));
            }
        }
        return rows.stream()
                .sorted(Comparator.comparing(TopicArticle::day).reversed()
                        .thenComparing(TopicArticle::title))
                .toList();
    }

    @Override
    public GraphStats stats() {
        return new GraphStats(
                articles.size(),
                topics.size(),
                entities.size(),
                projects.size(),
                articleTopics.size() + projectTopics.size(),
                articleEntities.size(),
                articleProjects.size(),
                similarityEdges.size());
    }

    @Override
    public BackendType backendType() {
        return BackendType.IN_MEMORY;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        articles.clear();
        topics.clear();
        entities.clear();
        projects.clear();
        articleTopics.clear();
        articleEntities.clear();
        articleProjects.clear();
        projectTopics.clear();
        similarityEdges.clear();
    }

    /**
     * Description of a project node, or null when none is known.
     */
    public String projectDescription(String projectName) {
        ProjectNode node = projects.get(projectName);
        return node == null ? null : node.description;
    }

    /**
     * Type of an entity node, or null when the entity is unknown.
     */
    public String entityType(String entityName) {
        EntityNode node = entities.get(entityName);
        return node == null ? null : node.type;
    }

    private void mergeTopic(String topic) {
        topics.putIfAbsent(topic, clock.instant());
    }

    private List<String> topicsOf(String articleId, String marker) {
        Set<String> names = new TreeSet<>();
        for (Link link : articleTopics) {
            if (link.from().equals(articleId) && link.to().contains(marker)) {
                names.add(link.to());
            }
        }
        return List.copyOf(names);
    }

    private void checkDimensions(List<Double> embedding) {
        int actual = embedding == null ? 0 : embedding.size();
        if (actual != dimensions) {
            throw new SchemaViolationException(BackendType.IN_MEMORY, dimensions, actual);
        }
    }

    /**
     * Cosine similarity, or null when either vector has zero norm (Neo4j does not index such vectors).
     */
    static Double cosine(List<Double> left, List<Double> right) {
        double dot = 0;
        double leftNorm = 0;
        double rightNorm = 0;
        for (int i = 0; i < left.size(); i++) {
            double l = left.get(i);
            double r = right.get(i);
            dot += l * r;
            leftNorm += l * l;
            rightNorm += r * r;
        }
        if (leftNorm == 0 || rightNorm == 0) {
            return null;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record Link(String from, String to) {
    }

    /**
     * @param ingestion position of the first upsert of this article
     */
    private record StoredArticle(Article article, List<Double> embedding, long ingestion) {

        String messageId() {
            return article.getMessageId();
        }

        Instant publishedAt() {
            return article.getPublishedAt();
        }

        LocalDate day() {
            return LocalDate.ofInstant(article.getPublishedAt(), ZoneOffset.UTC);
        }
    }

    private record ProjectRow(Instant publishedAt, ProjectArticle article) {
    }

    private static final class EntityNode {
        private final Instant createdAt;
        private String type;

        private EntityNode(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }

    private static final class ProjectNode {
        private final Instant createdAt;
        private String description;

        private ProjectNode(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }
}
