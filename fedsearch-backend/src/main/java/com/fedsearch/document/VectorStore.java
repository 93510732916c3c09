package com.fedsearch.document;

import java.util.List;
import java.util.Map;

/**
 * Similarity search over embedded documents.
 */
public interface VectorStore {

    /**
     * @param vector query embedding
     * @param topK maximum number of hits
     * @param filter payload equality filter, may be empty
     * @return hits by descending score
     * @throws DocumentSearchException if the store cannot be queried
     */
    List<VectorHit> query(float[] vector, int topK, Map<String, Object> filter);
}
