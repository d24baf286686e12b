package com.purchasingpower.newsgraph.exception;

import com.purchasingpower.newsgraph.graph.BackendType;
import lombok.Getter;

/**
 * The graph backend could not be reached (connection refused, session expired, transport error).
 */
@Getter
public class BackendUnavailableException extends NewsGraphException {

    private final BackendType backend;

    public BackendUnavailableException(BackendType backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendUnavailableException(BackendType backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }
}
