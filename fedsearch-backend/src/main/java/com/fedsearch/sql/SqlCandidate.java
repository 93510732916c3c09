package com.fedsearch.sql;

import java.util.List;

/**
 * Unvalidated SQL produced by a generation strategy.
 *
 * @param sql SQL text
 * @param confidence strategy confidence in [0, 1]
 * @param tables tables the strategy built the query on
 */
public record SqlCandidate(String sql, double confidence, List<String> tables) {
}
