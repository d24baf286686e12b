package com.purchasingpower.newsgraph.exception;

import com.purchasingpower.newsgraph.graph.BackendType;
import lombok.Getter;

/**
 * A write does not fit the store schema, e.g. an embedding whose length differs from the vector index.
 */
@Getter
public class SchemaViolationException extends QueryRejectedException {

    private final int expectedDimensions;
    private final int actualDimensions;

    public SchemaViolationException(BackendType backend, int expectedDimensions, int actualDimensions) {
        super(backend,
                String.format("Embedding has %d dimensions but the store is configured for %d",
                        actualDimensions, expectedDimensions),
                (String) null);
        this.expectedDimensions = expectedDimensions;
        this.actualDimensions = actualDimensions;
    }
}
