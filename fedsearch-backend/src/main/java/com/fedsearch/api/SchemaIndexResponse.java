package com.fedsearch.api;

import com.fedsearch.schema.TableIntrospectionError;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class SchemaIndexResponse {
    private String connectionId;
    private List<String> tables;
    private List<TableIntrospectionError> errors;
    private Instant indexedAt;
    private String fingerprint;

    /**
     * Refresh only: whether drift was detected and a new snapshot swapped in.
     */
    private Boolean drifted;
    private String traceId;
}
