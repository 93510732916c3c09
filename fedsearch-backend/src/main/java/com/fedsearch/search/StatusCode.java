package com.fedsearch.search;

/**
 * Per-source outcome reported on every search response.
 */
public enum StatusCode {
    OK,

    /**
     * SQL path only: some connections answered, others were rejected or failed.
     */
    DEGRADED,
    FAILED,
    TIMEOUT,

    /**
     * The source was not requested.
     */
    SKIPPED
}
