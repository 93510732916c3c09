package com.fedsearch.sql;

import lombok.Getter;

/**
 * Thrown when a query is asked to run but did not pass validation. Never retried.
 */
@Getter
public class QueryRejectedException extends RuntimeException {
    private final String connectionId;
    private final String sql;

    public QueryRejectedException(String connectionId, String sql, String reason) {
        super(reason);
        this.connectionId = connectionId;
        this.sql = sql;
    }
}
