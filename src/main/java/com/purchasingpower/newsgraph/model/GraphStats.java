package com.purchasingpower.newsgraph.model;

/**
 * Node and relationship counts of the article graph.
 */
public record GraphStats(long articles,
                         long topics,
                         long entities,
                         long projects,
                         long aboutRelations,
                         long mentionsRelations,
                         long featuresRelations,
                         long similarityEdges) {
}
