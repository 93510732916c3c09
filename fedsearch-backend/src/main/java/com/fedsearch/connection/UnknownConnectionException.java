package com.fedsearch.connection;

import lombok.Getter;

/**
 * Thrown when a connection id is not configured.
 */
@Getter
public class UnknownConnectionException extends RuntimeException {
    private final String connectionId;

    /**
     * Create a new exception.
     *
     * @param connectionId the unknown id
     */
    public UnknownConnectionException(String connectionId) {
        super("Unknown connection: " + connectionId);
        this.connectionId = connectionId;
    }
}
