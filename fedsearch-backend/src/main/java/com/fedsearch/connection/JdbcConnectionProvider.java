package com.fedsearch.connection;

import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.config.FedSearchProperties.ConnectionProperties;
import com.fedsearch.connection.dialect.SqlDialect;
import com.fedsearch.schema.ColumnDescriptor;
import com.fedsearch.schema.SchemaIntrospectionException;
import com.fedsearch.schema.TableDescriptor;
import com.fedsearch.util.JdbcValues;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link ConnectionProvider} over JDBC with one lazily created HikariCP pool per configured connection.
 */
@Slf4j
@Component
public class JdbcConnectionProvider implements ConnectionProvider, AutoCloseable {

    private final Map<String, ConnectionProperties> connections = new LinkedHashMap<>();
    private final Map<String, SqlDialect> dialects = new ConcurrentHashMap<>();
    private final Map<String, HikariDataSource> dataSources = new ConcurrentHashMap<>();

    /**
     * Create a provider for the configured connections. Dialects are resolved eagerly so a bad
     * configuration fails at startup; pools are opened on first use.
     *
     * @param properties service configuration
     */
    public JdbcConnectionProvider(FedSearchProperties properties) {
        for (ConnectionProperties props : properties.getConnections()) {
            if (props.getId() == null || props.getId().isBlank()) {
                throw new IllegalArgumentException("Connection id is required");
            }
            if (props.getJdbcUrl() == null || props.getJdbcUrl().isBlank()) {
                throw new IllegalArgumentException("jdbc-url is required for connection: " + props.getId());
            }
            if (connections.putIfAbsent(props.getId(), props) != null) {
                throw new IllegalArgumentException("Duplicate connection id: " + props.getId());
            }
            dialects.put(props.getId(), SqlDialect.forName(props.getDialect()));
        }
        log.info("Configured connections: {}", connections.keySet());
    }

    @Override
    public List<ConnectionDescriptor> listConnections() {
        return connections.keySet().stream().map(this::descriptor).toList();
    }

    @Override
    public ConnectionDescriptor descriptor(String connectionId) {
        ConnectionProperties props = props(connectionId);
        return ConnectionDescriptor.builder()
                .id(props.getId())
                .dialect(dialects.get(connectionId).name())
                .cacheTtl(props.getCacheTtl())
                .rowLimit(props.getRowLimit())
                .build();
    }

    @Override
    public RowSet execute(String connectionId, String sql, List<Object> params, int rowLimit) {
        ConnectionProperties props = props(connectionId);
        SqlDialect dialect = dialects.get(connectionId);
        int limit = rowLimit > 0 ? Math.min(rowLimit, props.getRowLimit()) : props.getRowLimit();
        String boundSql = dialect.applyRowBound(sql);

        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource(connectionId).getConnection()) {
            conn.setReadOnly(true);
            try (PreparedStatement stmt = conn.prepareStatement(boundSql)) {
                if (props.getQueryTimeoutMs() > 0) {
                    stmt.setQueryTimeout(Math.max(1, props.getQueryTimeoutMs() / 1000));
                }
                // One extra row tells us whether the result was cut off.
                stmt.setMaxRows(limit + 1);
                if (params != null) {
                    for (int i = 0; i < params.size(); i++) {
                        stmt.setObject(i + 1, params.get(i));
                    }
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    RowSet rowSet = readRows(rs, limit, System.currentTimeMillis() - startTime);
                    log.debug("Executed query: connection={}, rows={}, truncated={}, durationMs={}",
                            connectionId, rowSet.size(), rowSet.isTruncated(), rowSet.getDurationMs());
                    return rowSet;
                }
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(connectionId,
                    "Query failed on connection " + connectionId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listTables(String connectionId) {
        SqlDialect dialect = dialect(connectionId);
        Set<String> systemSchemas = dialect.systemSchemas().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<String> tables = new ArrayList<>();
        try (Connection conn = dataSource(connectionId).getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            try (ResultSet rs = meta.getTables(conn.getCatalog(), null, "%", new String[]{"TABLE", "VIEW"})) {
                while (rs.next()) {
                    String schema = rs.getString("TABLE_SCHEM");
                    String name = rs.getString("TABLE_NAME");
                    if (name == null || name.startsWith("sqlite_")) {
                        continue;
                    }
                    if (schema != null && systemSchemas.contains(schema.toLowerCase(Locale.ROOT))) {
                        continue;
                    }
                    if (!tables.contains(name)) {
                        tables.add(name);
                    }
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(connectionId,
                    "Cannot list tables of connection " + connectionId + ": " + e.getMessage(), e);
        }
        return tables;
    }

    @Override
    public TableDescriptor describeTable(String connectionId, String tableName, int sampleRows) {
        SqlDialect dialect = dialect(connectionId);
        try (Connection conn = dataSource(connectionId).getConnection()) {
            List<ColumnDescriptor> columns = new ArrayList<>();
            String schema = null;
            try (ResultSet rs = conn.getMetaData().getColumns(conn.getCatalog(), null, tableName, "%")) {
                while (rs.next()) {
                    // The table name argument is a LIKE pattern.
                    if (!tableName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        continue;
                    }
                    String rowSchema = rs.getString("TABLE_SCHEM") != null
                            ? rs.getString("TABLE_SCHEM") : rs.getString("TABLE_CAT");
                    if (columns.isEmpty()) {
                        schema = rowSchema;
                    } else if (!Objects.equals(schema, rowSchema)) {
                        // Same name in another schema.
                        continue;
                    }
                    columns.add(new ColumnDescriptor(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
                }
            }
            if (columns.isEmpty()) {
                throw new SchemaIntrospectionException(connectionId, tableName,
                        "No columns found for table " + tableName, null);
            }

            List<Map<String, Object>> samples = new ArrayList<>();
            if (sampleRows > 0) {
                conn.setReadOnly(true);
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(dialect.sampleRowsSql(tableName, sampleRows))) {
                    samples.addAll(readRows(rs, sampleRows, 0).getRows());
                }
            }

            return TableDescriptor.builder()
                    .name(tableName)
                    .schema(schema)
                    .columns(columns)
                    .sampleRows(samples)
                    .build();
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(connectionId, tableName,
                    "Cannot describe table " + tableName + ": " + e.getMessage(), e);
        }
    }

    private RowSet readRows(ResultSet rs, int limit, long durationMs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<ColumnDescriptor> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new ColumnDescriptor(rsmd.getColumnLabel(i), rsmd.getColumnTypeName(i)));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1).getName(), JdbcValues.read(rs, i));
            }
            rows.add(row);
        }

        return RowSet.builder()
                .columns(columns)
                .rows(rows)
                .truncated(truncated)
                .durationMs(durationMs)
                .build();
    }

    private ConnectionProperties props(String connectionId) {
        ConnectionProperties props = connectionId != null ? connections.get(connectionId) : null;
        if (props == null) {
            throw new UnknownConnectionException(connectionId);
        }
        return props;
    }

    private SqlDialect dialect(String connectionId) {
        props(connectionId);
        return dialects.get(connectionId);
    }

    private HikariDataSource dataSource(String connectionId) {
        ConnectionProperties props = props(connectionId);
        return dataSources.computeIfAbsent(connectionId, id -> {
            log.info("Opening pool: connection={}, dialect={}", id, dialects.get(id).name());
            return new HikariDataSource(buildHikariConfig(props, dialects.get(id)));
        });
    }

    private HikariConfig buildHikariConfig(ConnectionProperties props, SqlDialect dialect) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(props.getJdbcUrl());
        config.setDriverClassName(dialect.driverClassName());
        dialect.configure(config, props);
        config.setReadOnly(true);
        config.setConnectionTimeout(props.getConnectionTimeoutMs());
        config.setMaximumPoolSize(props.getMaxPoolSize());
        config.setMinimumIdle(0);
        config.setPoolName("fedsearch-" + props.getId());
        // Do not fail application startup when a backend is down.
        config.setInitializationFailTimeout(-1);
        return config;
    }

    /**
     * Close all pools.
     */
    @PreDestroy
    @Override
    public void close() {
        for (Map.Entry<String, HikariDataSource> entry : dataSources.entrySet()) {
            log.info("Closing pool: connection={}", entry.getKey());
            entry.getValue().close();
        }
        dataSources.clear();
    }
}
