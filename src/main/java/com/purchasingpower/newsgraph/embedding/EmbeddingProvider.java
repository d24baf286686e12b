package com.purchasingpower.newsgraph.embedding;

import java.util.List;

/**
 * Maps text to a vector of fixed length.
 *
 * <p>The graph store is parameterized by {@link #dimensions()}, so an implementation must return vectors of
 * exactly that length for every input.
 *
 * @see EmbeddingProviderSelector
 */
public interface EmbeddingProvider {

    /**
     * Text used to discover the vector length of providers that do not publish it.
     */
    String DIMENSION_SAMPLE = "dimension sample";

    /**
     * @param text text to embed, not blank
     * @return vector of {@link #dimensions()} values
     * @throws com.purchasingpower.newsgraph.exception.EmbeddingUnavailableException if the provider fails
     *                                                                              or returns no vector
     */
    List<Double> embed(String text);

    int dimensions();

    /**
     * Human readable provider name for logs and fallback reports.
     */
    String name();
}
