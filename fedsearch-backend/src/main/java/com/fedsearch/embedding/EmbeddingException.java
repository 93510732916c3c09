package com.fedsearch.embedding;

/**
 * Thrown when an embedding backend cannot produce a vector.
 */
public class EmbeddingException extends RuntimeException {
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }

    public EmbeddingException(String message) {
        super(message);
    }
}
