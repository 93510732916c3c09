package com.fedsearch.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedsearch.llm.LanguageModelClient;
import com.fedsearch.schema.ColumnDescriptor;
import com.fedsearch.schema.TableDescriptor;
import com.fedsearch.schema.TableMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Asks the language model for SQL, giving it only the retrieved tables as context.
 */
@Slf4j
@Component
@Order(1)
public class LanguageModelSqlStrategy implements SqlGenerationStrategy {

    static final double CONFIDENCE = 0.8;
    private static final int PROMPT_SAMPLE_ROWS = 2;

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z0-9_-]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final Pattern STATEMENT_START = Pattern.compile("\\b(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private final LanguageModelClient client;
    private final ObjectMapper objectMapper;

    public LanguageModelSqlStrategy(LanguageModelClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerationMethod method() {
        return GenerationMethod.LLM;
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }

    @Override
    public SqlCandidate generate(GenerationContext context) {
        String reply = client.complete(buildPrompt(context));
        String sql = extractSql(reply);
        if (sql.isBlank()) {
            throw new SqlGenerationException("language model reply contained no SQL");
        }
        String upper = sql.toUpperCase(Locale.ROOT);
        List<String> tables = context.matches().stream()
                .map(m -> m.table().getName())
                .filter(name -> upper.contains(name.toUpperCase(Locale.ROOT)))
                .toList();
        return new SqlCandidate(sql, CONFIDENCE, tables);
    }

    String buildPrompt(GenerationContext context) {
        StringBuilder sb = new StringBuilder("Given the following database tables:\n\n");
        for (TableMatch match : context.matches()) {
            TableDescriptor table = match.table();
            sb.append("Table: ").append(table.getName()).append('\n');
            sb.append("Columns:\n");
            for (ColumnDescriptor column : table.getColumns()) {
                sb.append("  - ").append(column.getName()).append(" (").append(column.getType()).append(")\n");
            }
            List<Map<String, Object>> samples = table.getSampleRows();
            if (samples != null && !samples.isEmpty()) {
                sb.append("Sample rows:\n");
                samples.stream().limit(PROMPT_SAMPLE_ROWS).forEach(row -> sb.append("  - ").append(row).append('\n'));
            }
            sb.append('\n');
        }
        sb.append("Write one SQL query for the request:\n\"").append(context.nlQuery().trim()).append("\"\n\n");
        sb.append("Requirements:\n");
        sb.append("1. Use only the tables and columns listed above.\n");
        sb.append("2. A single read-only SELECT statement, no trailing semicolon, no comments.\n");
        sb.append("3. Include JOINs only if more than one table is needed.\n");
        sb.append("4. Target SQL dialect: ").append(context.dialect()).append(".\n");
        sb.append("Return only the SQL.");
        return sb.toString();
    }

    /**
     * Pull the statement out of a reply that may be fenced markdown, a JSON object with a
     * {@code sql} field, or plain text with surrounding prose.
     */
    String extractSql(String reply) {
        if (reply == null) {
            return "";
        }
        String s = reply.trim();

        Matcher fence = FENCE.matcher(s);
        if (fence.find()) {
            s = fence.group(1).trim();
        }

        if (s.startsWith("{")) {
            try {
                JsonNode sqlNode = objectMapper.readTree(s).path("sql");
                s = sqlNode.isTextual() ? sqlNode.asText().trim() : "";
            } catch (IOException e) {
                log.debug("Language model reply looked like JSON but did not parse: {}", e.getMessage());
            }
        }

        Matcher start = STATEMENT_START.matcher(s);
        if (start.find() && start.start() > 0) {
            s = s.substring(start.start());
        }
        s = s.lines().map(String::trim).collect(Collectors.joining(" ")).trim();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
