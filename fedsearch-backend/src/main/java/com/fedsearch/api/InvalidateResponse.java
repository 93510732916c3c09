package com.fedsearch.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InvalidateResponse {

    /**
     * Values: key, connection, all
     */
    private String scope;
    private String target;
    private int invalidated;
    private String traceId;
}
