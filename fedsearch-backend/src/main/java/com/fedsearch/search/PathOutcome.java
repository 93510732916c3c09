package com.fedsearch.search;

import java.util.List;

/**
 * Terminal result of one retrieval path as produced by the path itself.
 */
record PathOutcome(List<SearchResult> results, StatusCode status, String reason) {

    static PathOutcome ok(List<SearchResult> results) {
        return new PathOutcome(results, StatusCode.OK, null);
    }
}
