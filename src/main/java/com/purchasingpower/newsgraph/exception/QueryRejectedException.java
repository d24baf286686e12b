package com.purchasingpower.newsgraph.exception;

import com.purchasingpower.newsgraph.graph.BackendType;
import lombok.Getter;

/**
 * The backend refused a statement: syntax error, constraint violation or a non-2xx HTTP answer.
 */
@Getter
public class QueryRejectedException extends NewsGraphException {

    private final BackendType backend;

    /**
     * Raw detail returned by the backend, e.g. the HTTP response body. May be null.
     */
    private final String detail;

    public QueryRejectedException(BackendType backend, String message, String detail) {
        super(message);
        this.backend = backend;
        this.detail = detail;
    }

    public QueryRejectedException(BackendType backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.detail = cause != null ? cause.getMessage() : null;
    }
}
