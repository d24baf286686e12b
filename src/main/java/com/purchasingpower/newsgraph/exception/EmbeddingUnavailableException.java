package com.purchasingpower.newsgraph.exception;

import lombok.Getter;

/**
 * The embedding provider failed or returned no vector.
 */
@Getter
public class EmbeddingUnavailableException extends NewsGraphException {

    private final String provider;

    public EmbeddingUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public EmbeddingUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
