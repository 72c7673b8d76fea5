package com.archcodex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One failed constraint evaluation against one file.
 *
 * <p>This is the stable boundary artifact every presentation layer consumes; the field set must
 * not change shape. {@code severity}, {@code why} and {@code source} always come from the
 * constraint that produced the violation.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Violation v = Violation.builder("E001", "must_extend", Severity.ERROR)
 *     .value("BaseService")
 *     .message("Class 'PaymentService' has no base class; must extend 'BaseService'")
 *     .line(3).column(1)
 *     .fixHint("Add 'extends BaseService' to the class declaration")
 *     .build();
 * }</pre>
 *
 * @param code stable rule-specific code, e.g. {@code E001}
 * @param rule rule kind
 * @param value constraint value, may be null
 * @param severity severity copied from the constraint
 * @param line 1-based line, null when the violation is file-level
 * @param column 1-based column, null when unknown
 * @param message human-readable description
 * @param why constraint rationale, may be null
 * @param fixHint concrete remediation text, may be null
 * @param source originating architecture or mixin id
 * @param suggestion structured remediation, may be null
 * @param didYouMean canonical alternative, may be null
 * @param alternatives approved alternatives
 */
public record Violation(
    String code,
    String rule,
    Object value,
    Severity severity,
    Integer line,
    Integer column,
    String message,
    String why,
    String fixHint,
    String source,
    Suggestion suggestion,
    DidYouMean didYouMean,
    List<Alternative> alternatives
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        source = source != null ? source : "";
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    public static Builder builder(String code, String rule, Severity severity) {
        return new Builder(code, rule, severity);
    }

    /**
     * Copy with a different severity; used by strict mode and override policies, never by validators.
     *
     * @param newSeverity severity to apply
     * @return re-graded violation
     */
    public Violation withSeverity(Severity newSeverity) {
        return new Violation(code, rule, value, newSeverity, line, column, message, why, fixHint, source,
            suggestion, didYouMean, alternatives);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Fluent builder for violations.
     */
    public static final class Builder {
        private final String code;
        private final String rule;
        private final Severity severity;
        private Object value;
        private Integer line;
        private Integer column;
        private String message;
        private String why;
        private String fixHint;
        private String source;
        private Suggestion suggestion;
        private DidYouMean didYouMean;
        private List<Alternative> alternatives;

        private Builder(String code, String rule, Severity severity) {
            this.code = code;
            this.rule = rule;
            this.severity = severity;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder column(Integer column) {
            this.column = column;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder why(String why) {
            this.why = why;
            return this;
        }

        public Builder fixHint(String fixHint) {
            this.fixHint = fixHint;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder suggestion(Suggestion suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder didYouMean(DidYouMean didYouMean) {
            this.didYouMean = didYouMean;
            return this;
        }

        public Builder alternatives(List<Alternative> alternatives) {
            this.alternatives = alternatives;
            return this;
        }

        public Violation build() {
            return new Violation(code, rule, value, severity, line, column, message, why, fixHint, source,
                suggestion, didYouMean, alternatives);
        }
    }
}
