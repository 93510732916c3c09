package com.fedsearch.document;

import com.fedsearch.embedding.Vectors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force cosine search over documents held in memory. Suitable for tests and small
 * deployments; documents are added with {@link #upsert}.
 */
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();

    public void upsert(String docId, float[] vector, Map<String, Object> payload) {
        documents.put(docId, new StoredDocument(docId, vector.clone(), Map.copyOf(payload)));
    }

    public void remove(String docId) {
        documents.remove(docId);
    }

    public int size() {
        return documents.size();
    }

    @Override
    public List<VectorHit> query(float[] vector, int topK, Map<String, Object> filter) {
        List<VectorHit> hits = new ArrayList<>();
        for (StoredDocument doc : documents.values()) {
            if (!matches(doc.payload(), filter)) {
                continue;
            }
            hits.add(new VectorHit(doc.docId(), Vectors.cosine(vector, doc.vector()), doc.payload()));
        }
        hits.sort(Comparator.comparingDouble(VectorHit::score).reversed().thenComparing(VectorHit::docId));
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    }

    private static boolean matches(Map<String, Object> payload, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object actual = payload.get(condition.getKey());
            if (!Objects.equals(String.valueOf(actual), String.valueOf(condition.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private record StoredDocument(String docId, float[] vector, Map<String, Object> payload) {
    }
}
