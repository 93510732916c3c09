package com.fedsearch.sql;

import com.fedsearch.schema.ColumnDescriptor;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.TableDescriptor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword-pattern generator. Always available; used as the fallback when the
 * language model is unavailable or produces unusable SQL.
 */
@Component
@Order(2)
public class RuleBasedSqlStrategy implements SqlGenerationStrategy {

    static final int DEFAULT_LIMIT = 100;
    private static final double MAX_CONFIDENCE = 0.9;

    private static final String CLAUSE_END =
            "(?=\\s+(?:and|or|order|sort|sorted|group|per|limit|top|first)\\b|[,?!]|\\.(?:\\s|$)|$)";

    private static final Pattern COUNT = Pattern.compile("\\b(count|how many|number of)\\b");
    private static final Pattern AGGREGATE = Pattern.compile(
            "\\b(sum|average|avg|maximum|max|minimum|min)\\s+(?:of\\s+)?(?:the\\s+)?(\\w+)");
    private static final Pattern FILTER = Pattern.compile(
            "\\b(?:where|with|having)\\s+(\\w+)\\s*(=|is|equals|contains)\\s*(?:'([^']*)'|\"([^\"]*)\"|(.+?)" + CLAUSE_END + ")",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTAINS = Pattern.compile(
            "\\b(\\w+)\\s+contains\\s+(?:'([^']*)'|\"([^\"]*)\"|(\\S+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARE = Pattern.compile(
            "\\b(\\w+)\\s+(?:is\\s+)?(greater than|more than|less than|above|over|below|under)\\s+(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern ORDER = Pattern.compile(
            "\\b(?:order|sort)(?:ed)?\\s+by\\s+(\\w+)(?:\\s+(desc|descending|asc|ascending))?");
    private static final Pattern LIMIT = Pattern.compile("\\b(?:top|first|limit)\\s+(\\d+)");
    private static final Pattern ALL_ROWS = Pattern.compile("\\b(all|every)\\b");
    private static final Pattern GROUP = Pattern.compile("\\b(?:group\\s+by|per|by each)\\s+(\\w+)");
    private static final Pattern JOIN = Pattern.compile("\\b(?:join|combine|merge)\\s+(\\w+)\\s+(?:and|with)\\s+(\\w+)");
    private static final Pattern COMPARISON_PHRASE = Pattern.compile(
            "^(?:greater than|more than|less than|above|over|below|under)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public GenerationMethod method() {
        return GenerationMethod.RULE_BASED;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public SqlCandidate generate(GenerationContext context) {
        if (context.matches().isEmpty()) {
            throw new SqlGenerationException("no relevant tables");
        }
        String original = context.nlQuery().trim();
        String nl = original.toLowerCase(Locale.ROOT);
        // Text used to find projected columns; clause spans are blanked out as they are consumed.
        StringBuilder projectionText = new StringBuilder(nl);

        Scope scope = resolveScope(nl, context);
        double confidence = 0.5;

        List<String> select = new ArrayList<>();
        List<String> where = new ArrayList<>();
        String groupBy = null;
        String orderBy = null;

        Matcher join = JOIN.matcher(nl);
        if (join.find() && scope.joined()) {
            blank(projectionText, join.start(), join.end());
            confidence += 0.1;
        }

        String aggregate = null;
        Matcher count = COUNT.matcher(nl);
        if (count.find()) {
            aggregate = "COUNT(*)";
            confidence = Math.max(confidence, 0.7);
            blank(projectionText, count.start(), count.end());
        }
        Matcher agg = AGGREGATE.matcher(nl);
        if (agg.find()) {
            Optional<String> column = scope.findColumn(agg.group(2));
            if (column.isPresent()) {
                aggregate = aggregateFunction(agg.group(1)) + "(" + column.get() + ")";
                confidence = Math.max(confidence, 0.7);
                blank(projectionText, agg.start(), agg.end());
            }
        }

        Matcher filter = FILTER.matcher(original);
        while (filter.find()) {
            Optional<String> column = scope.findColumn(filter.group(1));
            if (column.isEmpty()) {
                continue;
            }
            String value = firstNonNull(filter.group(3), filter.group(4), filter.group(5)).trim();
            if (COMPARISON_PHRASE.matcher(value).find()) {
                continue;
            }
            String operator = filter.group(2).toLowerCase(Locale.ROOT);
            if ("contains".equals(operator)) {
                where.add(column.get() + " LIKE " + quote("%" + value + "%"));
            } else {
                where.add(column.get() + " = " + literal(value));
            }
            confidence += 0.1;
            blank(projectionText, filter.start(), filter.end());
        }
        if (where.isEmpty()) {
            Matcher contains = CONTAINS.matcher(original);
            while (contains.find()) {
                Optional<String> column = scope.findColumn(contains.group(1));
                if (column.isPresent()) {
                    String value = firstNonNull(contains.group(2), contains.group(3), contains.group(4));
                    where.add(column.get() + " LIKE " + quote("%" + value + "%"));
                    confidence += 0.1;
                    blank(projectionText, contains.start(), contains.end());
                }
            }
        }
        Matcher compare = COMPARE.matcher(nl);
        while (compare.find()) {
            Optional<String> column = scope.findColumn(compare.group(1));
            if (column.isPresent()) {
                String phrase = compare.group(2);
                String operator = phrase.startsWith("less") || phrase.equals("below") || phrase.equals("under") ? "<" : ">";
                where.add(column.get() + " " + operator + " " + compare.group(3));
                confidence += 0.1;
                blank(projectionText, compare.start(), compare.end());
            }
        }

        Matcher group = GROUP.matcher(nl);
        if (group.find()) {
            Optional<String> column = scope.findColumn(group.group(1));
            if (column.isPresent()) {
                groupBy = column.get();
                blank(projectionText, group.start(), group.end());
            }
        }

        Matcher order = ORDER.matcher(nl);
        if (order.find()) {
            Optional<String> column = scope.findColumn(order.group(1));
            if (column.isPresent()) {
                boolean desc = order.group(2) != null && order.group(2).startsWith("desc");
                orderBy = column.get() + (desc ? " DESC" : " ASC");
                confidence += 0.1;
            }
            blank(projectionText, order.start(), order.end());
        }

        Integer limit = null;
        Matcher limitMatch = LIMIT.matcher(nl);
        if (limitMatch.find()) {
            limit = Integer.parseInt(limitMatch.group(1));
            blank(projectionText, limitMatch.start(), limitMatch.end());
        } else if (!ALL_ROWS.matcher(nl).find()) {
            limit = DEFAULT_LIMIT;
        }

        if (groupBy != null) {
            select.add(groupBy);
            select.add(aggregate != null ? aggregate : "COUNT(*)");
        } else if (aggregate != null) {
            select.add(aggregate);
        } else {
            List<String> mentioned = scope.mentionedColumns(projectionText.toString());
            if (mentioned.isEmpty()) {
                select.add("*");
            } else {
                select.addAll(mentioned);
                confidence = Math.max(confidence, 0.6);
            }
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", select));
        sql.append(" FROM ").append(scope.fromClause());
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(groupBy);
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return new SqlCandidate(sql.toString(), Math.min(confidence, MAX_CONFIDENCE), scope.tableNames());
    }

    private Scope resolveScope(String nl, GenerationContext context) {
        TableDescriptor primary = context.matches().get(0).table();
        Matcher join = JOIN.matcher(nl);
        if (join.find()) {
            Optional<TableDescriptor> left = findTable(join.group(1), context.snapshot());
            Optional<TableDescriptor> right = findTable(join.group(2), context.snapshot());
            if (left.isPresent() && right.isPresent() && !left.get().getName().equals(right.get().getName())) {
                String condition = joinCondition(left.get(), right.get());
                if (condition == null) {
                    throw new SqlGenerationException("cannot derive a join condition between "
                            + left.get().getName() + " and " + right.get().getName());
                }
                return new Scope(List.of(left.get(), right.get()), condition);
            }
        }
        return new Scope(List.of(primary), null);
    }

    /**
     * {@code a.id = b.a_id}, the reverse, or a column the two tables share.
     */
    static String joinCondition(TableDescriptor a, TableDescriptor b) {
        String aName = identifier(a.getName());
        String bName = identifier(b.getName());
        String aKey = singular(a.getName().toLowerCase(Locale.ROOT)) + "_id";
        String bKey = singular(b.getName().toLowerCase(Locale.ROOT)) + "_id";
        if (b.findColumn(aKey).isPresent() && a.findColumn("id").isPresent()) {
            return aName + "." + identifier(a.findColumn("id").get().getName()) + " = "
                    + bName + "." + identifier(b.findColumn(aKey).get().getName());
        }
        if (a.findColumn(bKey).isPresent() && b.findColumn("id").isPresent()) {
            return aName + "." + identifier(a.findColumn(bKey).get().getName()) + " = "
                    + bName + "." + identifier(b.findColumn("id").get().getName());
        }
        for (ColumnDescriptor column : a.getColumns()) {
            if (!"id".equalsIgnoreCase(column.getName()) && b.findColumn(column.getName()).isPresent()) {
                String name = identifier(column.getName());
                return aName + "." + name + " = " + bName + "." + identifier(b.findColumn(column.getName()).get().getName());
            }
        }
        return null;
    }

    private static Optional<TableDescriptor> findTable(String word, SchemaSnapshot snapshot) {
        Optional<TableDescriptor> exact = snapshot.findTable(word);
        if (exact.isPresent()) {
            return exact;
        }
        String wanted = singular(word.toLowerCase(Locale.ROOT));
        return snapshot.getTables().stream()
                .filter(t -> singular(t.getName().toLowerCase(Locale.ROOT)).equals(wanted))
                .findFirst();
    }

    private static String aggregateFunction(String word) {
        return switch (word) {
            case "sum" -> "SUM";
            case "average", "avg" -> "AVG";
            case "maximum", "max" -> "MAX";
            default -> "MIN";
        };
    }

    static String literal(String value) {
        return NUMBER.matcher(value).matches() ? value : quote(value);
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    static String identifier(String name) {
        return PLAIN_IDENTIFIER.matcher(name).matches() ? name : "\"" + name.replace("\"", "\"\"") + "\"";
    }

    static String singular(String word) {
        if (word.endsWith("ies") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if ((word.endsWith("ses") || word.endsWith("xes")) && word.length() > 4) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) {
                return v;
            }
        }
        return "";
    }

    private static void blank(StringBuilder text, int start, int end) {
        for (int i = start; i < end && i < text.length(); i++) {
            text.setCharAt(i, ' ');
        }
    }

    /**
     * Tables a rule-based query reads from, with column lookup over all of them.
     */
    private record Scope(List<TableDescriptor> tables, String joinCondition) {

        boolean joined() {
            return tables.size() > 1;
        }

        List<String> tableNames() {
            return tables.stream().map(TableDescriptor::getName).toList();
        }

        String fromClause() {
            if (!joined()) {
                return identifier(tables.get(0).getName());
            }
            return identifier(tables.get(0).getName()) + " JOIN " + identifier(tables.get(1).getName())
                    + " ON " + joinCondition;
        }

        /**
         * Exact name, then containment either way, then any underscore-separated part.
         */
        Optional<String> findColumn(String word) {
            String wanted = word.toLowerCase(Locale.ROOT);
            String wantedSingular = singular(wanted);
            for (TableDescriptor table : tables) {
                for (ColumnDescriptor column : table.getColumns()) {
                    String name = column.getName().toLowerCase(Locale.ROOT);
                    if (name.equals(wanted) || name.equals(wantedSingular)) {
                        return Optional.of(render(table, column));
                    }
                }
            }
            for (TableDescriptor table : tables) {
                for (ColumnDescriptor column : table.getColumns()) {
                    String name = column.getName().toLowerCase(Locale.ROOT);
                    if (wantedSingular.length() > 2 && (name.contains(wantedSingular) || (name.length() > 2 && wanted.contains(name)))) {
                        return Optional.of(render(table, column));
                    }
                }
            }
            for (TableDescriptor table : tables) {
                for (ColumnDescriptor column : table.getColumns()) {
                    for (String part : column.getName().toLowerCase(Locale.ROOT).split("_")) {
                        if (part.length() > 2 && part.equals(wantedSingular)) {
                            return Optional.of(render(table, column));
                        }
                    }
                }
            }
            return Optional.empty();
        }

        List<String> mentionedColumns(String text) {
            List<String> out = new ArrayList<>();
            for (TableDescriptor table : tables) {
                for (ColumnDescriptor column : table.getColumns()) {
                    String name = column.getName().toLowerCase(Locale.ROOT);
                    String spoken = Pattern.quote(name.replace('_', ' '));
                    Pattern mention = Pattern.compile("\\b(" + Pattern.quote(name) + "|" + spoken + ")s?\\b");
                    String rendered = render(table, column);
                    if (mention.matcher(text).find() && !out.contains(rendered)) {
                        out.add(rendered);
                    }
                }
            }
            return out;
        }

        private String render(TableDescriptor table, ColumnDescriptor column) {
            String col = identifier(column.getName());
            return joined() ? identifier(table.getName()) + "." + col : col;
        }
    }
}
