package com.fedsearch.connection;

import com.fedsearch.schema.SchemaIntrospectionException;
import com.fedsearch.schema.TableDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Access to the relational tier. Implementations own driver, pooling and dialect details;
 * callers only ever pass a connection id.
 */
public interface ConnectionProvider {

    List<ConnectionDescriptor> listConnections();

    /**
     * @param connectionId connection id
     * @return descriptor
     * @throws UnknownConnectionException if the id is not configured
     */
    ConnectionDescriptor descriptor(String connectionId);

    /**
     * Execute a read-only query.
     *
     * @param connectionId connection id
     * @param sql validated SELECT statement
     * @param params positional parameters, may be empty
     * @param rowLimit maximum number of rows to fetch
     * @return fetched rows
     * @throws QueryExecutionException on backend failure
     */
    RowSet execute(String connectionId, String sql, List<Object> params, int rowLimit);

    /**
     * @throws SchemaIntrospectionException if the table list cannot be read
     */
    List<String> listTables(String connectionId);

    /**
     * Describe one table, including up to {@code sampleRows} sample rows.
     *
     * @throws SchemaIntrospectionException if this table cannot be introspected
     */
    TableDescriptor describeTable(String connectionId, String tableName, int sampleRows);

    /**
     * Describe every table of a connection. Fails on the first table that cannot be described;
     * callers that need per-table tolerance iterate {@link #listTables} themselves.
     */
    default List<TableDescriptor> introspect(String connectionId, int sampleRows) {
        List<TableDescriptor> out = new ArrayList<>();
        for (String table : listTables(connectionId)) {
            out.add(describeTable(connectionId, table, sampleRows));
        }
        return out;
    }
}
