package com.purchasingpower.newsgraph.detection;

import com.purchasingpower.newsgraph.graph.KnowledgeGraphStore;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Finds earlier articles similar to a freshly stored one and records them as SIMILAR_TO edges.
 *
 * <p>Holds no state between calls; the policy can be overridden per call.
 */
@Slf4j
@RequiredArgsConstructor
public class DuplicateDetector {

    private final KnowledgeGraphStore store;
    private final DetectionPolicy defaultPolicy;

    public List<SimilarMatch> detect(String articleId, List<Double> embedding) {
        return detect(articleId, embedding, defaultPolicy);
    }

    /**
     * Only articles ingested before {@code articleId} become duplicates; a later one, or one already linked
     * to it, is left alone.
     *
     * @return the matches that were linked, best first; empty when nothing reached the threshold
     */
    public List<SimilarMatch> detect(String articleId, List<Double> embedding, DetectionPolicy policy) {
        List<SimilarMatch> candidates = store.findSimilarArticles(embedding, articleId, policy.limit(),
                policy.minScore());
        List<SimilarMatch> matches = candidates.isEmpty() ? candidates
                : store.createSimilarityLinks(articleId, candidates);
        if (matches.isEmpty()) {
            log.debug("No duplicates of {} at >= {}", articleId, policy.minScore());
            return matches;
        }
        log.info("🔗 {} linked to {} similar article(s), best {} ({})",
                articleId, matches.size(), matches.get(0).messageId(), String.format("%.3f", matches.get(0).score()));
        return matches;
    }

    public DetectionPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
