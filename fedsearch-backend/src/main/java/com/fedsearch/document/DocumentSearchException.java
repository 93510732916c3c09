package com.fedsearch.document;

/**
 * Thrown when the document store cannot be queried.
 */
public class DocumentSearchException extends RuntimeException {
    public DocumentSearchException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocumentSearchException(String message) {
        super(message);
    }
}
