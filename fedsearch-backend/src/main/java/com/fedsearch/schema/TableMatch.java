package com.fedsearch.schema;

/**
 * A table found relevant to a natural-language query.
 *
 * @param table indexed table
 * @param relevance cosine relevance in [0, 1]
 */
public record TableMatch(TableDescriptor table, double relevance) {
}
