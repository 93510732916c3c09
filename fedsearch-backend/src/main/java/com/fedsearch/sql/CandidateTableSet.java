package com.fedsearch.sql;

import java.util.List;

/**
 * A set of tables that could answer a query, with the relevance of its best table.
 *
 * @param tables table names
 * @param relevance relevance in [0, 1]
 */
public record CandidateTableSet(List<String> tables, double relevance) {
}
