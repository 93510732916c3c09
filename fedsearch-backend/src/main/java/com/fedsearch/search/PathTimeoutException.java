package com.fedsearch.search;

import lombok.Getter;

/**
 * A retrieval path did not finish within its budget.
 */
@Getter
public class PathTimeoutException extends RuntimeException {
    private final SourceType source;
    private final long timeoutMs;

    public PathTimeoutException(SourceType source, long timeoutMs) {
        super(source + " path exceeded its " + timeoutMs + "ms budget");
        this.source = source;
        this.timeoutMs = timeoutMs;
    }
}
