package com.fedsearch.embedding;

/**
 * Turns text into a fixed-length vector. Used for both table descriptions and queries, so the
 * same implementation must embed both sides.
 */
public interface EmbeddingService {

    /**
     * @param text text to embed
     * @return embedding of length {@link #dimension()}
     * @throws EmbeddingException if the embedding backend fails
     */
    float[] embed(String text);

    int dimension();
}
