package com.fedsearch.llm;

/**
 * Optional text-completion backend. Callers check {@link #isAvailable()} on every use;
 * an unavailable model is not an error.
 */
public interface LanguageModelClient {

    boolean isAvailable();

    /**
     * @param prompt full prompt
     * @return completion text
     * @throws LanguageModelException on transport or provider errors
     */
    String complete(String prompt);
}
