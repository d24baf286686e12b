package com.purchasingpower.newsgraph.graph.cypher;

import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.GraphStats;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import com.purchasingpower.newsgraph.model.SimilarityEdge;
import com.purchasingpower.newsgraph.model.TopicArticle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts result rows into model records.
 *
 * <p>Rows come either from the Bolt driver ({@code Record.asMap()}) or from Jackson-decoded Query API
 * responses, so numbers may arrive as any {@link Number} and temporal values as strings.
 */
public final class CypherRowMapper {

    private CypherRowMapper() {
    }

    public static SimilarMatch similarMatch(Map<String, Object> row) {
        return new SimilarMatch(
                string(row, "messageId"),
                string(row, "title"),
                string(row, "url"),
                number(row, "score").doubleValue());
    }

    public static SimilarityEdge similarityEdge(Map<String, Object> row) {
        return new SimilarityEdge(
                string(row, "sourceId"),
                string(row, "targetId"),
                number(row, "score").doubleValue(),
                instant(row.get("lastChecked")));
    }

    public static DigestEntry digestEntry(Map<String, Object> row) {
        return new DigestEntry(day(row), string(row, "title"), string(row, "url"), strings(row, "topics"));
    }

    public static EntityArticle entityArticle(Map<String, Object> row) {
        return new EntityArticle(string(row, "title"), string(row, "url"), day(row));
    }

    public static ProjectArticle projectArticle(Map<String, Object> row) {
        return new ProjectArticle(string(row, "project"), string(row, "title"), string(row, "url"), day(row));
    }

    public static TopicArticle topicArticle(Map<String, Object> row) {
        return new TopicArticle(string(row, "title"), string(row, "url"), day(row), strings(row, "topics"));
    }

    public static GraphStats graphStats(Map<String, Object> row) {
        return new GraphStats(
                number(row, "articles").longValue(),
                number(row, "topics").longValue(),
                number(row, "entities").longValue(),
                number(row, "projects").longValue(),
                number(row, "aboutRelations").longValue(),
                number(row, "mentionsRelations").longValue(),
                number(row, "featuresRelations").longValue(),
                number(row, "similarityEdges").longValue());
    }

    private static String string(Map<String, Object> row, String field) {
        Object value = row.get(field);
        return value == null ? null : value.toString();
    }

    private static Number number(Map<String, Object> row, String field) {
        Object value = row.get(field);
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            return Double.valueOf(s);
        }
        throw new IllegalStateException("Column '" + field + "' is not numeric: " + value);
    }

    private static LocalDate day(Map<String, Object> row) {
        Object value = row.get("day");
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        return LocalDate.parse(value.toString());
    }

    private static Instant instant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof TemporalAccessor temporal && !(value instanceof LocalDate)) {
            return Instant.from(temporal);
        }
        // Neo4j renders zoned datetimes as e.g. 2025-01-02T10:15:30.123Z or with a [Region/Id] suffix
        return ZonedDateTime.parse(value.toString()).toInstant();
    }

    private static List<String> strings(Map<String, Object> row, String field) {
        Object value = row.get(field);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }
}
