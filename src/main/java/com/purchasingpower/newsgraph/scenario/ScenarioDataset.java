package com.purchasingpower.newsgraph.scenario;

/**
 * Article source of a scenario run.
 */
public enum ScenarioDataset {
    /**
     * Six articles covering topics, entities, projects and one near-duplicate pair.
     */
    SYNTHETIC,
    /**
     * Two near-identical WAN 2.5 announcements minutes apart.
     */
    SIMILAR_PAIR,
    /**
     * JSON array read from {@code newsgraph.scenario.input-file}.
     */
    FILE
}
