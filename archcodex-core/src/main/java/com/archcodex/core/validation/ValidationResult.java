package com.archcodex.core.validation;

import com.archcodex.core.model.Violation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Result of validating one file.
 *
 * <p>Violations are partitioned by severity: {@code violations} holds errors (and, in strict
 * mode, warnings), {@code warnings} and {@code infos} the rest. Overrides that suppressed a
 * violation are listed in {@code activeOverrides}, never dropped silently.
 *
 * @param filePath validated file
 * @param status overall outcome
 * @param archId resolved architecture, null for untagged or failed files
 * @param inheritanceChain architecture ids from root to leaf
 * @param mixinsApplied applied mixin ids
 * @param violations error-level findings
 * @param warnings warning-level findings
 * @param infos info-level findings
 * @param activeOverrides overrides in force
 */
public record ValidationResult(
    String filePath,
    ValidationStatus status,
    String archId,
    List<String> inheritanceChain,
    List<String> mixinsApplied,
    List<Violation> violations,
    List<Violation> warnings,
    List<Violation> infos,
    List<ActiveOverride> activeOverrides
) {
    public ValidationResult {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(status, "status must not be null");
        inheritanceChain = inheritanceChain != null ? List.copyOf(inheritanceChain) : List.of();
        mixinsApplied = mixinsApplied != null ? List.copyOf(mixinsApplied) : List.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        infos = infos != null ? List.copyOf(infos) : List.of();
        activeOverrides = activeOverrides != null ? List.copyOf(activeOverrides) : List.of();
    }

    /**
     * Result for a file that could not be validated.
     *
     * @param filePath file path
     * @param archId architecture id if known
     * @param violation the failure (S002, S003, S999)
     * @return result with status {@link ValidationStatus#ERROR}
     */
    public static ValidationResult error(String filePath, String archId, Violation violation) {
        return new ValidationResult(filePath, ValidationStatus.ERROR, archId, null, null, List.of(violation),
            null, null, null);
    }

    public static ValidationResult skipped(String filePath) {
        return new ValidationResult(filePath, ValidationStatus.SKIPPED, null, null, null, null, null, null, null);
    }

    /**
     * Whether the file passed: no error-level violations and no validation failure.
     *
     * @return true for PASS, WARN and SKIPPED
     */
    public boolean passed() {
        return status != ValidationStatus.FAIL && status != ValidationStatus.ERROR;
    }

    public int errorCount() {
        return violations.size();
    }

    public int warningCount() {
        return warnings.size();
    }

    /**
     * Every finding, errors first.
     *
     * @return violations, warnings and infos
     */
    public List<Violation> allViolations() {
        return Stream.of(violations, warnings, infos).flatMap(List::stream).toList();
    }
}
