package com.archcodex.core.resolver;

import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.FlattenedArchitecture;
import com.archcodex.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link Resolver#resolveArchitecture}: the flattened architecture plus every conflict
 * encountered while flattening it.
 *
 * @param architecture resolved architecture
 * @param conflicts conflict reports in the order they were detected
 */
public record ResolutionResult(
    FlattenedArchitecture architecture,
    List<ConflictReport> conflicts
) {
    public ResolutionResult {
        Objects.requireNonNull(architecture, "architecture must not be null");
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    /**
     * Conflicts that resolution could not reconcile (e.g. require vs forbid on the same import).
     *
     * @return error-level conflicts
     */
    public List<ConflictReport> unresolvedConflicts() {
        return conflicts.stream()
            .filter(c -> c.severity() == Severity.ERROR)
            .toList();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
