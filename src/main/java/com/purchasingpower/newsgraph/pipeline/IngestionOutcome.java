package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.model.SimilarMatch;

import java.util.List;

/**
 * Result of ingesting one article.
 *
 * <p>Failures are recorded here instead of being thrown, so the orchestrator can carry on with the rest
 * of the batch. An article that was written but whose duplicate detection failed is still {@code FAILED}.
 *
 * @param messageId  article id as given in the input
 * @param title      article title, for the report
 * @param status     whether the article and its duplicate links were written
 * @param duplicates matches linked by SIMILAR_TO, empty for failed articles
 * @param error      failure message, null when ingested
 */
public record IngestionOutcome(String messageId, String title, Status status, List<SimilarMatch> duplicates,
                               String error) {

    public enum Status {
        INGESTED,
        FAILED
    }

    public IngestionOutcome {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }

    public static IngestionOutcome ingested(String messageId, String title, List<SimilarMatch> duplicates) {
        return new IngestionOutcome(messageId, title, Status.INGESTED, duplicates, null);
    }

    public static IngestionOutcome failed(String messageId, String title, String error) {
        return new IngestionOutcome(messageId, title, Status.FAILED, List.of(), error);
    }

    public boolean isIngested() {
        return status == Status.INGESTED;
    }
}
