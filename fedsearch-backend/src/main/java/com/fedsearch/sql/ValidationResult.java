package com.fedsearch.sql;

import java.util.List;

/**
 * Outcome of {@link SqlValidator#validate}.
 *
 * @param valid true if the statement may be executed
 * @param sql the bounded statement to execute, null when rejected
 * @param reason rejection reason, null when valid
 * @param tables tables the statement references
 */
public record ValidationResult(boolean valid, String sql, String reason, List<String> tables) {

    public static ValidationResult accepted(String sql, List<String> tables) {
        return new ValidationResult(true, sql, null, List.copyOf(tables));
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, null, reason, List.of());
    }
}
