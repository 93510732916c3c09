package com.fedsearch.connection.dialect;

import com.fedsearch.config.FedSearchProperties.ConnectionProperties;
import com.fedsearch.util.DialectNormalizer;
import com.zaxxer.hikari.HikariConfig;

import java.util.Set;

/**
 * Per-backend differences the connection layer has to know about. Query generation,
 * validation and caching never look at the dialect.
 */
public interface SqlDialect {

    /**
     * @return canonical dialect name
     */
    String name();

    String driverClassName();

    /**
     * Apply driver and credential settings to a pool configuration.
     *
     * @param config pool configuration, JDBC URL already set
     * @param props configured connection
     */
    default void configure(HikariConfig config, ConnectionProperties props) {
        config.setUsername(props.getUsername());
        config.setPassword(props.getPassword());
    }

    default String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    default String sampleRowsSql(String table, int rows) {
        return "SELECT * FROM " + quoteIdentifier(table) + " LIMIT " + rows;
    }

    /**
     * Render the row bound of a validated SELECT for this backend. The validator always emits
     * {@code LIMIT}; dialects without it rewrite the statement here.
     *
     * @param sql validated statement
     * @return statement to send to the driver
     */
    default String applyRowBound(String sql) {
        return sql;
    }

    /**
     * Schemas whose tables are never indexed.
     */
    default Set<String> systemSchemas() {
        return Set.of();
    }

    /**
     * Resolve a configured dialect name (aliases accepted).
     *
     * @param dialect dialect name
     * @return dialect implementation
     * @throws IllegalArgumentException for unsupported dialects
     */
    static SqlDialect forName(String dialect) {
        String normalized = DialectNormalizer.normalize(dialect);
        return switch (normalized) {
            case "postgres" -> new PostgresDialect();
            case "mysql" -> new MySqlDialect();
            case "sqlite" -> new SqliteDialect();
            case "sqlserver" -> new SqlServerDialect();
            default -> throw new IllegalArgumentException("Unsupported dialect: " + dialect);
        };
    }
}
