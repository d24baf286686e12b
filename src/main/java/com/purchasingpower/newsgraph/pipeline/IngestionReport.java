package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.graph.BackendType;

import java.util.List;

/**
 * Outcomes of one batch, in input order.
 *
 * <p>Rejected or unembeddable articles are recorded as failed outcomes, so a finished batch holds one
 * entry per input article. Only a backend that stays unavailable after retries ends the batch early.
 *
 * @param backend           store the batch was written to
 * @param embeddingProvider name of the provider that produced the vectors, e.g. {@code "Gemini (text-embedding-004)"}
 * @param outcomes          one entry per input article
 * @param durationMs        wall-clock time of the whole batch
 * @since 1.0.0
 */
public record IngestionReport(BackendType backend, String embeddingProvider, List<IngestionOutcome> outcomes,
                              long durationMs) {

    public IngestionReport {
        outcomes = List.copyOf(outcomes);
    }

    public long ingestedCount() {
        return outcomes.stream().filter(IngestionOutcome::isIngested).count();
    }

    public long failedCount() {
        return outcomes.size() - ingestedCount();
    }

    /**
     * Number of SIMILAR_TO edges this batch created or refreshed. Articles re-ingested after their
     * duplicates report nothing, so a repeated batch reports the edges of its first run only once.
     */
    public int duplicateLinkCount() {
        return outcomes.stream().mapToInt(outcome -> outcome.duplicates().size()).sum();
    }
}
