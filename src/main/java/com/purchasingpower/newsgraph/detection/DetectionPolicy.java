package com.purchasingpower.newsgraph.detection;

import com.google.common.base.Preconditions;

/**
 * How strict duplicate detection is.
 *
 * @param minScore lowest cosine similarity that counts as a duplicate, in [-1, 1]
 * @param limit    maximum number of duplicates linked per article
 */
public record DetectionPolicy(double minScore, int limit) {

    public DetectionPolicy {
        Preconditions.checkArgument(minScore >= -1.0 && minScore <= 1.0,
                "minScore must be within [-1, 1]: %s", minScore);
        Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
    }
}
