package com.fedsearch.schema;

import lombok.Getter;

/**
 * Thrown when schema metadata cannot be read. Table-level failures are caught by the index and
 * recorded on the snapshot; connection-level failures reach the caller.
 */
@Getter
public class SchemaIntrospectionException extends RuntimeException {
    private final String connectionId;
    private final String table;

    public SchemaIntrospectionException(String connectionId, String table, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
        this.table = table;
    }

    public SchemaIntrospectionException(String connectionId, String message, Throwable cause) {
        this(connectionId, null, message, cause);
    }
}
