package com.fedsearch.sql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of turning one question into SQL for one connection. {@code sqlText} is the validated,
 * row-bounded statement when the verdict is ACCEPTED; otherwise it is the last rejected
 * candidate (possibly null) and {@code reason} says why.
 */
@Value
@Builder
public class GeneratedQuery {
    String nlText;
    String connectionId;
    String sqlText;
    GenerationMethod method;
    Verdict verdict;
    String reason;
    @Singular
    List<String> tables;
    double confidence;

    /**
     * Relevance of the best table the query was grounded on.
     */
    double relevance;
    @Singular
    List<CandidateTableSet> alternates;
    @Singular
    List<String> warnings;

    @JsonIgnore
    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }
}
