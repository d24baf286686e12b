package com.purchasingpower.newsgraph.exception;

/**
 * Root of the unchecked exceptions raised by the knowledge graph pipeline.
 */
public abstract class NewsGraphException extends RuntimeException {

    protected NewsGraphException(String message) {
        super(message);
    }

    protected NewsGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
