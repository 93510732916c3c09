package com.fedsearch.connection;

import lombok.Getter;

/**
 * Thrown when a backend fails while running an already validated query. Never cached.
 */
@Getter
public class QueryExecutionException extends RuntimeException {
    private final String connectionId;

    public QueryExecutionException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public QueryExecutionException(String connectionId, String message) {
        this(connectionId, message, null);
    }
}
