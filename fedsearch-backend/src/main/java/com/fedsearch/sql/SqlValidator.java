package com.fedsearch.sql;

import com.fedsearch.schema.ColumnDescriptor;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.TableDescriptor;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Top;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gatekeeper between generated SQL and the databases. A statement is accepted only if it is a
 * single read-only SELECT over tables and columns present in the schema snapshot; accepted
 * statements are returned with a row bound no larger than the connection's row limit.
 *
 * <p>Column allow-listing covers the select list, WHERE, HAVING, GROUP BY, ORDER BY and join
 * conditions of every SELECT, subqueries and derived tables included. A subquery may refer to
 * the tables of the queries enclosing it. Schema-qualified tables must name the schema they were
 * introspected from.
 */
@Slf4j
@Component
public class SqlValidator {

    private static final Pattern FORBIDDEN_KEYWORD = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|REPLACE|DROP|CREATE|ALTER|TRUNCATE|RENAME|GRANT|REVOKE"
                    + "|EXEC|EXECUTE|CALL|ATTACH|DETACH|PRAGMA|VACUUM|COPY|LOCK|SHUTDOWN)\\b",
            Pattern.CASE_INSENSITIVE);

    // Server-side file, sleep and administration functions.
    private static final Set<String> DENIED_FUNCTIONS = Set.of(
            "pg_sleep", "pg_sleep_for", "pg_sleep_until", "pg_read_file", "pg_read_binary_file", "pg_ls_dir",
            "pg_stat_file", "lo_import", "lo_export", "pg_terminate_backend", "pg_cancel_backend",
            "pg_reload_conf", "set_config", "dblink", "dblink_exec", "sleep", "benchmark", "load_file",
            "get_lock", "xp_cmdshell", "openrowset", "opendatasource", "openquery", "load_extension",
            "readfile", "writefile");

    // The parser reads these as bare column references.
    private static final Set<String> KEYWORD_COLUMNS = Set.of(
            "true", "false", "null", "current_date", "current_time", "current_timestamp");

    /**
     * Validate a statement against a schema snapshot.
     *
     * @param sql candidate SQL
     * @param snapshot schema the statement may reference
     * @param rowLimit maximum rows the statement may return
     * @return accepted result with the bounded SQL, or a rejection with a reason
     */
    public ValidationResult validate(String sql, SchemaSnapshot snapshot, int rowLimit) {
        ValidationResult result = doValidate(sql, snapshot, rowLimit);
        if (!result.valid()) {
            log.debug("Rejected SQL: connection={}, reason={}", snapshot.getConnectionId(), result.reason());
        }
        return result;
    }

    private ValidationResult doValidate(String sql, SchemaSnapshot snapshot, int rowLimit) {
        if (sql == null || sql.isBlank()) {
            return ValidationResult.rejected("empty SQL");
        }
        String text = stripTrailingSemicolon(sql.trim());

        String masked = maskLiterals(text);
        if (masked == null) {
            return ValidationResult.rejected("unterminated string literal");
        }
        if (masked.indexOf(';') >= 0) {
            return ValidationResult.rejected("multiple statements are not allowed (statement stacking)");
        }
        if (masked.contains("--") || masked.contains("/*")) {
            return ValidationResult.rejected("SQL comments are not allowed");
        }
        Matcher keyword = FORBIDDEN_KEYWORD.matcher(text);
        if (keyword.find()) {
            return ValidationResult.rejected("forbidden keyword: " + keyword.group(1).toUpperCase(Locale.ROOT));
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(text);
        } catch (JSQLParserException e) {
            return ValidationResult.rejected("SQL does not parse: " + firstLine(e));
        }
        if (!(statement instanceof Select select)) {
            return ValidationResult.rejected("only SELECT statements are allowed, got: "
                    + statement.getClass().getSimpleName());
        }
        if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
            return ValidationResult.rejected("common table expressions (WITH) are not supported");
        }

        List<PlainSelect> plainSelects = new ArrayList<>();
        if (!collectPlainSelects(select, plainSelects)) {
            return ValidationResult.rejected("unsupported SELECT form: " + select.getClass().getSimpleName());
        }
        for (PlainSelect plain : plainSelects) {
            if (plain.getIntoTables() != null && !plain.getIntoTables().isEmpty()) {
                return ValidationResult.rejected("SELECT INTO is not allowed");
            }
        }

        Set<String> referencedTables = new TreeSet<>();
        Set<String> rawTableNames;
        try {
            rawTableNames = new TablesNamesFinder().getTables((Statement) select);
        } catch (UnsupportedOperationException e) {
            return ValidationResult.rejected("unsupported SQL construct: " + e.getMessage());
        }
        for (String raw : rawTableNames) {
            String[] parts = raw.trim().split("\\.");
            String name = unquote(parts[parts.length - 1]);
            Optional<TableDescriptor> table = snapshot.findTable(name);
            if (table.isEmpty()) {
                return ValidationResult.rejected("unknown table: " + name);
            }
            if (parts.length > 2) {
                return ValidationResult.rejected("cross-database references are not allowed: " + raw);
            }
            if (parts.length == 2 && !unquote(parts[0]).equalsIgnoreCase(table.get().getSchema())) {
                return ValidationResult.rejected("table outside the indexed schema: " + raw);
            }
            referencedTables.add(table.get().getName());
        }

        try {
            checkSelect(select, null, snapshot);
        } catch (Violation v) {
            return ValidationResult.rejected(v.getMessage());
        }

        applyRowBound(select, rowLimit);
        return ValidationResult.accepted(select.toString(), new ArrayList<>(referencedTables));
    }

    private boolean collectPlainSelects(Select select, List<PlainSelect> out) {
        if (select instanceof PlainSelect plain) {
            out.add(plain);
            return true;
        }
        if (select instanceof SetOperationList setOperations) {
            for (Select member : setOperations.getSelects()) {
                if (!collectPlainSelects(member, out)) {
                    return false;
                }
            }
            return true;
        }
        if (select instanceof ParenthesedSelect parenthesed) {
            return collectPlainSelects(parenthesed.getSelect(), out);
        }
        return false;
    }

    /**
     * Check every column reference of a SELECT, including those of nested subqueries.
     *
     * @param parent enclosing scope for correlated references, null at the top level
     * @return output column names, used when the SELECT is a derived table
     */
    private List<String> checkSelect(Select select, Scope parent, SchemaSnapshot snapshot) {
        if (select instanceof PlainSelect plain) {
            return checkPlainSelect(plain, parent, snapshot);
        }
        if (select instanceof SetOperationList setOperations) {
            List<String> outputs = null;
            for (Select member : setOperations.getSelects()) {
                List<String> memberOutputs = checkSelect(member, parent, snapshot);
                if (outputs == null) {
                    outputs = memberOutputs;
                }
            }
            return outputs != null ? outputs : List.of();
        }
        if (select instanceof ParenthesedSelect parenthesed) {
            return checkSelect(parenthesed.getSelect(), parent, snapshot);
        }
        throw new Violation("unsupported SELECT form: " + select.getClass().getSimpleName());
    }

    private List<String> checkPlainSelect(PlainSelect plain, Scope parent, SchemaSnapshot snapshot) {
        Scope scope = new Scope(parent);

        List<FromItem> fromItems = new ArrayList<>();
        if (plain.getFromItem() != null) {
            fromItems.add(plain.getFromItem());
        }
        if (plain.getJoins() != null) {
            for (Join join : plain.getJoins()) {
                fromItems.add(join.getRightItem());
            }
        }
        for (FromItem item : fromItems) {
            String alias = item.getAlias() != null ? unquote(item.getAlias().getName()).toLowerCase(Locale.ROOT) : null;
            if (item instanceof Table table) {
                TableDescriptor descriptor = snapshot.findTable(unquote(table.getName()))
                        .orElseThrow(() -> new Violation("unknown table: " + table.getName()));
                scope.tables.put(unquote(table.getName()).toLowerCase(Locale.ROOT), descriptor);
                if (alias != null) {
                    scope.tables.put(alias, descriptor);
                }
            } else if (item instanceof ParenthesedSelect derived) {
                // Derived tables cannot see their siblings, only the enclosing query.
                List<String> outputs = checkSelect(derived.getSelect(), parent, snapshot);
                TableDescriptor descriptor = TableDescriptor.builder()
                        .name(alias != null ? alias : "derived")
                        .columns(outputs.stream().map(name -> new ColumnDescriptor(name, null)).toList())
                        .build();
                scope.tables.put(alias != null ? alias : "#derived" + scope.tables.size(), descriptor);
            } else {
                throw new Violation("unsupported FROM item: " + item.getClass().getSimpleName());
            }
        }

        List<String> outputs = new ArrayList<>();
        List<Column> columns = new ArrayList<>();
        List<Select> subqueries = new ArrayList<>();
        ExpressionVisitorAdapter collector = new ExpressionVisitorAdapter() {
            @Override
            public void visit(Column column) {
                columns.add(column);
            }

            @Override
            public void visit(Function function) {
                String name = function.getName() == null ? "" : function.getName();
                String bare = name.substring(name.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
                if (DENIED_FUNCTIONS.contains(bare)) {
                    throw new Violation("function not allowed: " + name);
                }
                super.visit(function);
            }

            @Override
            public void visit(ParenthesedSelect subquery) {
                subqueries.add(subquery);
            }

            @Override
            public void visit(Select subquery) {
                subqueries.add(subquery);
            }
        };

        for (SelectItem<?> item : plain.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof AllTableColumns allTableColumns) {
                String ref = unquote(allTableColumns.getTable().getName()).toLowerCase(Locale.ROOT);
                TableDescriptor table = scope.tables.get(ref);
                if (table == null) {
                    throw new Violation("unknown table or alias: " + allTableColumns.getTable().getName());
                }
                outputs.addAll(table.columnNames());
            } else if (expression instanceof AllColumns) {
                scope.tables.values().stream().distinct().forEach(table -> outputs.addAll(table.columnNames()));
            } else {
                expression.accept(collector);
                if (item.getAlias() != null) {
                    outputs.add(unquote(item.getAlias().getName()));
                } else if (expression instanceof Column column) {
                    outputs.add(unquote(column.getColumnName()));
                }
            }
            if (item.getAlias() != null) {
                scope.selectAliases.add(unquote(item.getAlias().getName()).toLowerCase(Locale.ROOT));
            }
        }
        acceptIfPresent(plain.getWhere(), collector);
        acceptIfPresent(plain.getHaving(), collector);
        if (plain.getGroupBy() != null) {
            acceptIfPresent(plain.getGroupBy().getGroupByExpressionList(), collector);
        }
        if (plain.getOrderByElements() != null) {
            for (OrderByElement element : plain.getOrderByElements()) {
                acceptIfPresent(element.getExpression(), collector);
            }
        }
        if (plain.getJoins() != null) {
            for (Join join : plain.getJoins()) {
                if (join.getOnExpressions() != null) {
                    for (Expression on : join.getOnExpressions()) {
                        acceptIfPresent(on, collector);
                    }
                }
                if (join.getUsingColumns() != null) {
                    columns.addAll(join.getUsingColumns());
                }
            }
        }

        for (Column column : columns) {
            checkColumn(column, scope);
        }
        for (Select subquery : subqueries) {
            checkSelect(subquery, scope, snapshot);
        }
        return outputs;
    }

    private void checkColumn(Column column, Scope scope) {
        String name = unquote(column.getColumnName());
        Table qualifier = column.getTable();
        if (qualifier != null && qualifier.getName() != null) {
            String ref = unquote(qualifier.getName()).toLowerCase(Locale.ROOT);
            TableDescriptor table = scope.resolveTable(ref);
            if (table == null) {
                throw new Violation("unknown table or alias: " + qualifier.getName());
            }
            if (table.findColumn(name).isEmpty()) {
                throw new Violation("unknown column: " + table.getName() + "." + name);
            }
            return;
        }

        String lower = name.toLowerCase(Locale.ROOT);
        if (KEYWORD_COLUMNS.contains(lower) || scope.selectAliases.contains(lower)) {
            return;
        }
        for (Scope s = scope; s != null; s = s.parent) {
            for (TableDescriptor table : s.tables.values()) {
                if (table.findColumn(name).isPresent()) {
                    return;
                }
            }
        }
        throw new Violation("unknown column: " + name);
    }

    private static void acceptIfPresent(Expression expression, ExpressionVisitorAdapter visitor) {
        if (expression != null) {
            expression.accept(visitor);
        }
    }

    /**
     * Tables visible to one SELECT, keyed by lower-case name or alias, chained to the enclosing
     * query's scope.
     */
    private static final class Scope {
        private final Map<String, TableDescriptor> tables = new LinkedHashMap<>();
        private final Set<String> selectAliases = new HashSet<>();
        private final Scope parent;

        private Scope(Scope parent) {
            this.parent = parent;
        }

        private TableDescriptor resolveTable(String ref) {
            for (Scope s = this; s != null; s = s.parent) {
                TableDescriptor table = s.tables.get(ref);
                if (table != null) {
                    return table;
                }
            }
            return null;
        }
    }

    private static final class Violation extends RuntimeException {
        private Violation(String message) {
            super(message, null, false, false);
        }
    }

    /**
     * Add {@code LIMIT rowLimit} to an unbounded statement and clamp larger explicit bounds.
     */
    private void applyRowBound(Select select, int rowLimit) {
        if (select instanceof PlainSelect plain && plain.getTop() != null) {
            Top top = plain.getTop();
            if (!(top.getExpression() instanceof LongValue value) || value.getValue() > rowLimit) {
                top.setExpression(new LongValue(rowLimit));
            }
            return;
        }
        Select bounded = select;
        if (select instanceof SetOperationList setOperations && select.getLimit() == null
                && !setOperations.getSelects().isEmpty()) {
            // A LIMIT written after a set operation is parsed onto its last member.
            Select last = setOperations.getSelects().get(setOperations.getSelects().size() - 1);
            if (last instanceof PlainSelect && (last.getLimit() != null || last.getFetch() != null)) {
                bounded = last;
            }
        }
        if (bounded.getFetch() != null) {
            // FETCH FIRST n ROWS is left as written; the driver-level max rows still applies.
            return;
        }
        Limit limit = bounded.getLimit();
        if (limit == null) {
            bounded.setLimit(new Limit().withRowCount(new LongValue(rowLimit)));
            return;
        }
        if (!(limit.getRowCount() instanceof LongValue value) || value.getValue() > rowLimit) {
            limit.setRowCount(new LongValue(rowLimit));
        }
    }

    static String stripTrailingSemicolon(String sql) {
        String s = sql;
        if (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    /**
     * Replace the contents of quoted strings and identifiers with underscores so that
     * semicolons and comment markers inside them are ignored.
     *
     * @return masked text, or null if a quote is not closed
     */
    static String maskLiterals(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote == 0) {
                if (c == '\'' || c == '"' || c == '`') {
                    quote = c;
                }
                out.append(c);
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    out.append("__");
                    i++;
                } else {
                    quote = 0;
                    out.append(c);
                }
            } else {
                out.append('_');
            }
        }
        return quote == 0 ? out.toString() : null;
    }

    static String unquote(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return identifier;
        }
        char first = identifier.charAt(0);
        char last = identifier.charAt(identifier.length() - 1);
        if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    private static String firstLine(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : e.getMessage();
        if (message == null) {
            return "syntax error";
        }
        int nl = message.indexOf('\n');
        return (nl > 0 ? message.substring(0, nl) : message).trim();
    }
}
