package com.fedsearch.search;

import java.util.List;
import java.util.Map;

/**
 * Combines the independently scored result lists of each source into one ordered list.
 */
public interface ScoreFusion {

    /**
     * @param resultsBySource results of each source in within-path order
     * @return all results with {@code normalizedScore} set, in a deterministic total order
     */
    List<SearchResult> fuse(Map<SourceType, List<SearchResult>> resultsBySource);
}
