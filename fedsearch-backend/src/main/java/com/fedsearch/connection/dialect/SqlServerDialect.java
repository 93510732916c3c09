package com.fedsearch.connection.dialect;

import com.fedsearch.config.FedSearchProperties.ConnectionProperties;
import com.zaxxer.hikari.HikariConfig;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Top;

import java.util.Set;

/**
 * SQL Server. Supports Windows integrated authentication and renders {@code LIMIT n} as
 * {@code TOP n}.
 */
@Slf4j
public class SqlServerDialect implements SqlDialect {

    @Override
    public String name() {
        return "sqlserver";
    }

    @Override
    public String driverClassName() {
        return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
    }

    @Override
    public void configure(HikariConfig config, ConnectionProperties props) {
        if (props.isIntegratedAuth()) {
            // Needs the mssql-jdbc_auth native library on java.library.path.
            config.addDataSourceProperty("integratedSecurity", "true");
        } else {
            SqlDialect.super.configure(config, props);
        }
        config.addDataSourceProperty("applicationName", "fedsearch");
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public String sampleRowsSql(String table, int rows) {
        return "SELECT TOP " + rows + " * FROM " + quoteIdentifier(table);
    }

    /**
     * Rewrites {@code LIMIT n} as {@code TOP n}, and {@code LIMIT n OFFSET m} as
     * {@code OFFSET m ROWS FETCH NEXT n ROWS ONLY}. A bound written after a set operation is
     * parsed onto its last member and is applied to the combined result.
     */
    @Override
    public String applyRowBound(String sql) {
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            log.warn("Could not parse statement for TOP rewrite, sending unchanged: {}", e.getMessage());
            return sql;
        }
        if (!(statement instanceof Select select)) {
            return sql;
        }

        Select bounded = boundHolder(select);
        Limit limit = bounded.getLimit();
        Offset offset = bounded.getOffset();
        Expression rowCount = limit != null ? limit.getRowCount() : null;
        Expression skip = offset != null ? offset.getOffset() : limit != null ? limit.getOffset() : null;
        if (rowCount == null && skip == null) {
            return sql;
        }
        bounded.setLimit(null);
        bounded.setOffset(null);

        if (skip == null) {
            if (select instanceof PlainSelect plain && plain.getTop() == null) {
                plain.setTop(new Top().withExpression(rowCount));
                return plain.toString();
            }
            return "SELECT TOP " + rowCount + " * FROM (" + select + ") AS bounded_result";
        }

        // OFFSET ... FETCH needs an ORDER BY in T-SQL.
        StringBuilder out = new StringBuilder();
        if (select instanceof PlainSelect plain) {
            out.append(plain);
            if (plain.getOrderByElements() == null || plain.getOrderByElements().isEmpty()) {
                out.append(" ORDER BY (SELECT NULL)");
            }
        } else {
            out.append("SELECT * FROM (").append(select).append(") AS bounded_result ORDER BY (SELECT NULL)");
        }
        out.append(" OFFSET ").append(skip).append(" ROWS");
        if (rowCount != null) {
            out.append(" FETCH NEXT ").append(rowCount).append(" ROWS ONLY");
        }
        return out.toString();
    }

    private static Select boundHolder(Select select) {
        if (select.getLimit() == null && select.getOffset() == null
                && select instanceof SetOperationList setOperations && !setOperations.getSelects().isEmpty()) {
            Select last = setOperations.getSelects().get(setOperations.getSelects().size() - 1);
            if (last instanceof PlainSelect && (last.getLimit() != null || last.getOffset() != null)) {
                return last;
            }
        }
        return select;
    }

    @Override
    public Set<String> systemSchemas() {
        return Set.of("sys", "INFORMATION_SCHEMA");
    }
}
