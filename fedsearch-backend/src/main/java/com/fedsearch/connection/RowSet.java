package com.fedsearch.connection;

import com.fedsearch.schema.ColumnDescriptor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Tabular result of a read-only query. Rows preserve column order.
 */
@Value
@Builder
public class RowSet {
    List<ColumnDescriptor> columns;
    List<Map<String, Object>> rows;
    boolean truncated;
    long durationMs;

    public int size() {
        return rows != null ? rows.size() : 0;
    }
}
