package com.fedsearch.sql;

import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.connection.ConnectionDescriptor;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.schema.SchemaIndexService;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.TableMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a question into validated SQL for one connection.
 *
 * <p>Strategies are tried in order (language model first, rule-based last). A strategy that is
 * unavailable is skipped; one that fails or produces SQL the validator rejects hands over to
 * the next. The query is REJECTED only when the last strategy fails too.
 */
@Slf4j
@Service
public class SqlGenerator {

    private final SchemaIndexService schemaIndex;
    private final SqlValidator validator;
    private final ConnectionProvider connectionProvider;
    private final List<SqlGenerationStrategy> strategies;
    private final int topK;

    public SqlGenerator(SchemaIndexService schemaIndex,
                        SqlValidator validator,
                        ConnectionProvider connectionProvider,
                        List<SqlGenerationStrategy> strategies,
                        FedSearchProperties properties) {
        this.schemaIndex = schemaIndex;
        this.validator = validator;
        this.connectionProvider = connectionProvider;
        this.strategies = List.copyOf(strategies);
        this.topK = properties.getSchema().getTopK();
    }

    /**
     * @param nlQuery natural-language question
     * @param connectionId target connection
     * @return generated query; check {@link GeneratedQuery#getVerdict()}
     * @throws com.fedsearch.connection.UnknownConnectionException if the id is not configured
     * @throws com.fedsearch.schema.SchemaIntrospectionException if the schema cannot be indexed
     */
    public GeneratedQuery generate(String nlQuery, String connectionId) {
        ConnectionDescriptor connection = connectionProvider.descriptor(connectionId);
        GeneratedQuery.GeneratedQueryBuilder result = GeneratedQuery.builder()
                .nlText(nlQuery)
                .connectionId(connectionId);

        if (nlQuery == null || nlQuery.isBlank()) {
            return result.verdict(Verdict.REJECTED).reason("empty query").build();
        }

        List<TableMatch> matches = schemaIndex.findRelevantTables(nlQuery, connectionId, topK);
        if (matches.isEmpty()) {
            log.info("Generation rejected: connection={}, reason=no matching schema", connectionId);
            return result.verdict(Verdict.REJECTED).reason("no matching schema").build();
        }
        SchemaSnapshot snapshot = schemaIndex.snapshotFor(connectionId);
        GenerationContext context = new GenerationContext(nlQuery, connectionId, connection.getDialect(), matches, snapshot);

        String lastReason = "no generation strategy available";
        SqlCandidate lastCandidate = null;
        GenerationMethod lastMethod = null;
        List<String> warnings = new ArrayList<>();

        for (SqlGenerationStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                log.debug("Generation strategy unavailable: method={}", strategy.method());
                continue;
            }
            lastMethod = strategy.method();
            SqlCandidate candidate;
            try {
                candidate = strategy.generate(context);
            } catch (RuntimeException e) {
                lastReason = strategy.method() + " generation failed: " + e.getMessage();
                log.warn("Generation strategy failed: connection={}, method={}, reason={}",
                        connectionId, strategy.method(), e.getMessage());
                warnings.add(lastReason);
                continue;
            }
            lastCandidate = candidate;

            ValidationResult validation = validator.validate(candidate.sql(), snapshot, connection.getRowLimit());
            if (validation.valid()) {
                GeneratedQuery accepted = result
                        .sqlText(validation.sql())
                        .method(strategy.method())
                        .verdict(Verdict.ACCEPTED)
                        .tables(validation.tables())
                        .confidence(candidate.confidence())
                        .relevance(relevanceOf(validation.tables(), matches))
                        .alternates(alternates(validation.tables(), matches))
                        .warnings(warnings)
                        .build();
                log.info("Generated SQL: connection={}, method={}, verdict=ACCEPTED, tables={}",
                        connectionId, strategy.method(), validation.tables());
                return accepted;
            }
            lastReason = validation.reason();
            warnings.add(strategy.method() + " output rejected: " + validation.reason());
        }

        log.info("Generated SQL: connection={}, method={}, verdict=REJECTED, reason={}", connectionId, lastMethod, lastReason);
        return result
                .sqlText(lastCandidate != null ? lastCandidate.sql() : null)
                .method(lastMethod)
                .verdict(Verdict.REJECTED)
                .reason(lastReason)
                .tables(lastCandidate != null ? lastCandidate.tables() : List.of())
                .relevance(matches.get(0).relevance())
                .warnings(warnings)
                .build();
    }

    private static double relevanceOf(List<String> tables, List<TableMatch> matches) {
        return matches.stream()
                .filter(m -> containsIgnoreCase(tables, m.table().getName()))
                .mapToDouble(TableMatch::relevance)
                .max()
                .orElse(matches.get(0).relevance());
    }

    /**
     * Matched tables the chosen query did not use, in relevance order.
     */
    private static List<CandidateTableSet> alternates(List<String> tables, List<TableMatch> matches) {
        return matches.stream()
                .filter(m -> !containsIgnoreCase(tables, m.table().getName()))
                .map(m -> new CandidateTableSet(List.of(m.table().getName()), m.relevance()))
                .toList();
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
    }
}
