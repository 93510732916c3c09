package com.fedsearch.api;

import lombok.Builder;
import lombok.Data;

/**
 * Body of every non-2xx answer under {@code /v1}.
 */
@Data
@Builder
public class ErrorResponse {

    /**
     * Stable machine-readable code, e.g. {@code QUERY_REJECTED} or {@code UNKNOWN_CONNECTION}.
     */
    private String code;
    private String message;
    private String details;

    /**
     * Connection the failure belongs to; absent for errors not tied to one.
     */
    private String connectionId;

    /**
     * SQL the failure refers to: the rejected statement, or the one the backend failed on.
     */
    private String sql;
    private String traceId;
}
