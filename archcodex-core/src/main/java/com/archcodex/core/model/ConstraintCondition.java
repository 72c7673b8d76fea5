package com.archcodex.core.model;

import java.util.Objects;

/**
 * A {@code when} clause restricting where a constraint applies.
 *
 * <p>The resolver passes conditions through untouched; they are evaluated per file by the
 * validation orchestrator against the file's semantic model and path.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConstraintCondition onlyControllers = ConstraintCondition.hasDecorator("Controller");
 * ConstraintCondition notTests = ConstraintCondition.not(ConditionType.FILE_MATCHES, "*.test.ts");
 * }</pre>
 *
 * @param type what is checked
 * @param value decorator name, import specifier (glob allowed), class name or file glob
 * @param negated true for the {@code not_*} variant
 */
public record ConstraintCondition(
    ConditionType type,
    String value,
    boolean negated
) {
    public ConstraintCondition {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Kinds of condition, with their registry key.
     */
    public enum ConditionType {
        HAS_DECORATOR("has_decorator"),
        HAS_IMPORT("has_import"),
        EXTENDS("extends"),
        FILE_MATCHES("file_matches"),
        IMPLEMENTS("implements"),
        METHOD_HAS_DECORATOR("method_has_decorator");

        private final String key;

        ConditionType(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    public static ConstraintCondition of(ConditionType type, String value) {
        return new ConstraintCondition(type, value, false);
    }

    public static ConstraintCondition not(ConditionType type, String value) {
        return new ConstraintCondition(type, value, true);
    }

    public static ConstraintCondition hasDecorator(String decorator) {
        return of(ConditionType.HAS_DECORATOR, decorator);
    }

    public static ConstraintCondition hasImport(String specifier) {
        return of(ConditionType.HAS_IMPORT, specifier);
    }

    public static ConstraintCondition extendsClass(String className) {
        return of(ConditionType.EXTENDS, className);
    }

    public static ConstraintCondition fileMatches(String glob) {
        return of(ConditionType.FILE_MATCHES, glob);
    }

    /**
     * Registry key of this condition, e.g. {@code not_has_decorator}.
     *
     * @return key including the {@code not_} prefix when negated
     */
    public String key() {
        return negated ? "not_" + type.key() : type.key();
    }
}
