package com.fedsearch.sql;

/**
 * One way of turning a question into SQL. Strategies are tried in order until one produces
 * SQL the validator accepts.
 */
public interface SqlGenerationStrategy {

    GenerationMethod method();

    /**
     * Checked before every use.
     */
    boolean isAvailable();

    /**
     * @param context question and schema context
     * @return candidate SQL, not yet validated
     * @throws SqlGenerationException if no SQL can be produced
     */
    SqlCandidate generate(GenerationContext context);
}
