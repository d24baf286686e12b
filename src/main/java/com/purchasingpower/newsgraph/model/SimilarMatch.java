package com.purchasingpower.newsgraph.model;

/**
 * One hit of a vector similarity search. {@code score} is the cosine similarity in [-1, 1].
 */
public record SimilarMatch(String messageId, String title, String url, double score) {
}
