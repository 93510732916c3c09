package com.fedsearch.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Introspected table. {@code description} and {@code embedding} are filled in by the schema index.
 */
@Value
@Builder(toBuilder = true)
public class TableDescriptor {
    String name;

    /**
     * Schema the table was read from, or its catalog on backends without schemas. Null when the
     * driver reports neither.
     */
    String schema;
    List<ColumnDescriptor> columns;
    List<Map<String, Object>> sampleRows;
    String description;

    @JsonIgnore
    float[] embedding;

    /**
     * Case-insensitive column lookup.
     *
     * @param columnName column name, unquoted
     * @return matching column
     */
    public Optional<ColumnDescriptor> findColumn(String columnName) {
        if (columnName == null || columns == null) {
            return Optional.empty();
        }
        String wanted = columnName.toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.getName() != null && c.getName().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public List<String> columnNames() {
        return columns == null ? List.of() : columns.stream().map(ColumnDescriptor::getName).toList();
    }
}
