package com.fedsearch.sql;

/**
 * Thrown by a generation strategy that cannot produce SQL for a question.
 */
public class SqlGenerationException extends RuntimeException {
    public SqlGenerationException(String message) {
        super(message);
    }

    public SqlGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
