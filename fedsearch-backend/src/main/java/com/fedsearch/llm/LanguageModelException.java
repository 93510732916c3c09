package com.fedsearch.llm;

/**
 * Thrown when the language model cannot produce a completion.
 */
public class LanguageModelException extends RuntimeException {
    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }

    public LanguageModelException(String message) {
        super(message);
    }
}
