package com.archcodex.core.model;

import java.util.Locale;

/**
 * Severity of a constraint and of the violations it produces.
 *
 * <p>Validators never decide severity themselves: it is copied from the resolved
 * {@link Constraint}.
 *
 * @since 1.0.0
 */
public enum Severity {
    /** Fails validation */
    ERROR,
    /** Reported, does not fail validation unless strict mode is on */
    WARNING,
    /** Informational only */
    INFO;

    /**
     * Lowercase identifier used in messages and configuration.
     *
     * @return "error", "warning" or "info"
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity identifier, case-insensitively.
     *
     * @param value identifier such as "error"
     * @return parsed severity
     * @throws IllegalArgumentException if the value is not a known severity
     */
    public static Severity fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
