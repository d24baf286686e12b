package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import com.purchasingpower.newsgraph.model.TopicArticle;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text rendering of ingestion and query results.
 */
public final class ReportRenderer {

    private static final String NONE = "  (none)";
    private static final String NO_TOPICS = "No topic tags";

    private ReportRenderer() {
    }

    public static String render(IngestionReport report) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("Ingested %d of %d article(s) into %s using %s embeddings%n",
                report.ingestedCount(), report.outcomes().size(), report.backend(), report.embeddingProvider()));
        for (IngestionOutcome outcome : report.outcomes()) {
            if (!outcome.isIngested()) {
                out.append(String.format("- FAILED %s: %s%n", outcome.messageId(), outcome.error()));
                continue;
            }
            if (outcome.duplicates().isEmpty()) {
                continue;
            }
            out.append(String.format("- Potential duplicates for %s:%n", outcome.title()));
            for (SimilarMatch match : outcome.duplicates()) {
                out.append(String.format("    · %s (score=%.3f) → %s%n", match.title(), match.score(),
                        link(match.url())));
            }
        }
        return out.toString();
    }

    public static String render(QueryCatalogReport report) {
        StringBuilder out = new StringBuilder();

        out.append(String.format("Weekly digest (last %d days):%n", report.getDigestDays()));
        Map<LocalDate, List<DigestEntry>> byDay = new LinkedHashMap<>();
        for (DigestEntry entry : report.getDigest()) {
            byDay.computeIfAbsent(entry.day(), day -> new ArrayList<>()).add(entry);
        }
        if (byDay.isEmpty()) {
            out.append(NONE).append(System.lineSeparator());
        }
        byDay.forEach((day, entries) -> {
            out.append(String.format("  %s:%n", day));
            for (DigestEntry entry : entries) {
                out.append(String.format("    - %s [%s] → %s%n", entry.title(), topics(entry.topics()),
                        link(entry.url())));
            }
        });

        out.append(String.format("%nRecent %s news (last %d days):%n", report.getEntityName(),
                report.getEntityDays()));
        if (report.getEntityArticles().isEmpty()) {
            out.append(NONE).append(System.lineSeparator());
        }
        for (EntityArticle article : report.getEntityArticles()) {
            out.append(String.format("  - %s: %s → %s%n", article.day(), article.title(), link(article.url())));
        }

        out.append(String.format("%nProjects about %s:%n", report.getProjectTopic()));
        if (report.getProjects().isEmpty()) {
            out.append(NONE).append(System.lineSeparator());
        }
        for (ProjectArticle project : report.getProjects()) {
            out.append(String.format("  - %s: %s via %s → %s%n", project.day(), project.project(),
                    project.title(), link(project.url())));
        }

        out.append(String.format("%nTopics matching '%s':%n", report.getTopicMarker()));
        if (report.getTopicArticles().isEmpty()) {
            out.append(NONE).append(System.lineSeparator());
        }
        for (TopicArticle article : report.getTopicArticles()) {
            out.append(String.format("  - %s: %s [%s] → %s%n", article.day(), article.title(),
                    topics(article.topics()), link(article.url())));
        }
        return out.toString();
    }

    private static String topics(List<String> topics) {
        return topics == null || topics.isEmpty() ? NO_TOPICS : String.join(", ", topics);
    }

    private static String link(String url) {
        return url == null ? "(no link)" : url;
    }
}
