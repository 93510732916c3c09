package com.fedsearch.api;

import com.fedsearch.schema.TableMatch;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SchemaTablesResponse {
    private String connectionId;
    private List<String> columns;
    private List<TableMatch> tables;
    private String traceId;
}
