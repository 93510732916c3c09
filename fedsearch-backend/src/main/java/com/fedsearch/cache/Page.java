package com.fedsearch.cache;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One page of a cached result. Page numbers start at 1.
 */
@Value
@Builder
public class Page {
    String key;
    int pageNumber;
    int pageSize;
    int totalRows;
    int totalPages;
    boolean hasNext;
    boolean hasPrevious;
    List<Map<String, Object>> rows;
}
