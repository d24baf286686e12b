package com.purchasingpower.newsgraph.model;

import java.time.Instant;

/**
 * Directed SIMILAR_TO relation from a newer article to an earlier near-duplicate.
 */
public record SimilarityEdge(String sourceId, String targetId, double score, Instant lastChecked) {
}
