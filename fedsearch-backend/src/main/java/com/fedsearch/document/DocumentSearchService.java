package com.fedsearch.document;

import com.fedsearch.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Document retrieval path: embed the query, then ask the vector store.
 */
@Slf4j
@Service
public class DocumentSearchService {

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;

    public DocumentSearchService(EmbeddingService embeddingService, VectorStore vectorStore) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
    }

    public List<VectorHit> search(String nlQuery, int topK, Map<String, Object> filter) {
        long startTime = System.currentTimeMillis();
        float[] vector = embeddingService.embed(nlQuery);
        List<VectorHit> hits = vectorStore.query(vector, topK, filter == null ? Map.of() : filter);
        log.debug("Document search: hits={}, durationMs={}", hits.size(), System.currentTimeMillis() - startTime);
        return hits;
    }
}
