package com.archcodex.core.validator;

import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;

import java.util.List;

/**
 * Result of evaluating one constraint against one file.
 *
 * <p>{@code passed} is false exactly when at least one violation is not informational. Info-level
 * violations (for example "not evaluated" notes from cross-file rules) never fail an outcome.
 *
 * @param passed whether the constraint holds
 * @param violations violations found, in file order
 */
public record ValidationOutcome(boolean passed, List<Violation> violations) {

    private static final ValidationOutcome PASS = new ValidationOutcome(true, List.of());

    public ValidationOutcome {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static ValidationOutcome pass() {
        return PASS;
    }

    /**
     * Outcome derived from a list of violations.
     *
     * @param violations violations, possibly empty
     * @return passing outcome when no violation above info level exists
     */
    public static ValidationOutcome of(List<Violation> violations) {
        boolean passed = violations.stream().allMatch(v -> v.severity() == Severity.INFO);
        return new ValidationOutcome(passed, violations);
    }

    public static ValidationOutcome fail(Violation violation) {
        return of(List.of(violation));
    }
}
