package com.fedsearch.search;

import com.fedsearch.cache.CacheEntry;
import com.fedsearch.cache.Page;
import com.fedsearch.sql.GeneratedQuery;

/**
 * An accepted query after it went through the cache, with the first page of its rows.
 *
 * @param query generated query
 * @param entry cache entry holding the full result
 * @param firstPage first page at the requested page size
 */
public record ExecutedQuery(GeneratedQuery query, CacheEntry entry, Page firstPage) {
}
