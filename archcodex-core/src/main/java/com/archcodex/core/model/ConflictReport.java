package com.archcodex.core.model;

import java.util.Objects;

/**
 * Side-channel record of a constraint that resolution dropped, replaced or could not reconcile.
 *
 * <p>Conflicts are never silent: whenever a slot is redeclared, an allow rule cancels a
 * forbid rule, or two mixins disagree, a report is produced carrying the original constraint.
 *
 * @param rule rule kind of the slot
 * @param value slot value as text
 * @param winner source whose constraint is effective
 * @param loser source whose constraint was dropped (or disagrees)
 * @param dropped the losing constraint as it was declared, may be null for synthetic reports
 * @param resolution human-readable explanation
 * @param severity INFO for plain precedence, WARNING for reconciliations, ERROR for unresolvable pairs
 */
public record ConflictReport(
    String rule,
    String value,
    String winner,
    String loser,
    Constraint dropped,
    String resolution,
    Severity severity
) {
    public ConflictReport {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(resolution, "resolution must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        value = value != null ? value : "";
        winner = winner != null ? winner : "";
        loser = loser != null ? loser : "";
    }
}
