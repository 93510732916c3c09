package com.fedsearch.document;

import java.util.Map;

/**
 * A document returned by a similarity query.
 *
 * @param docId document id
 * @param score store-specific similarity, higher is better
 * @param payload document content and metadata
 */
public record VectorHit(String docId, double score, Map<String, Object> payload) {
}
