package com.archcodex.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One rule instance attached to an architecture or mixin.
 *
 * <p>The {@code value} is deliberately loosely typed: depending on the rule it is a string,
 * a list of strings, a number or a structured map (e.g. {@code require_companion_call}).
 * Accessors such as {@link #valueAsList()} and {@link #valueAsInt()} perform the conversions
 * validators need.
 *
 * <p>{@code source} records provenance. It is empty on registry definitions and is filled in
 * by the resolver with the originating architecture id or {@code mixin:<id>}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Constraint c = Constraint.builder("forbid_import")
 *     .value(List.of("axios", "node-fetch"))
 *     .severity(Severity.ERROR)
 *     .why("Use the shared HTTP client")
 *     .alternative("src/http/client")
 *     .build();
 * }</pre>
 *
 * @param rule rule kind, e.g. {@code must_extend}
 * @param value rule value (string, list, number or map), may be null
 * @param severity severity copied onto every violation
 * @param why rationale shown with violations
 * @param source originating architecture or mixin id
 * @param when structural condition, may be null
 * @param unless exemptions ({@code @intent:x}, {@code decorator:@X}, {@code import:x} or plain import)
 * @param appliesWhen content regex gating the constraint, may be null
 * @param pattern regex payload for pattern rules, may be null
 * @param around call patterns for {@code require_try_catch}
 * @param before call patterns that must precede, for {@code require_call_before}
 * @param match all/any semantics for multi-valued rules
 * @param naming structured naming spec, may be null
 * @param examples valid example names
 * @param counterexamples invalid example names
 * @param intent intent name for intent-aware rules, may be null
 * @param alternative single approved alternative module, may be null
 * @param alternatives detailed approved alternatives
 * @param excludeComments count lines of code instead of raw lines
 * @param override drop every inherited constraint with the same rule
 * @param category grouping label, may be null
 * @param codeExample example code, may be null
 */
public record Constraint(
    String rule,
    Object value,
    Severity severity,
    String why,
    String source,
    ConstraintCondition when,
    List<String> unless,
    String appliesWhen,
    String pattern,
    List<String> around,
    List<String> before,
    MatchMode match,
    NamingSpec naming,
    List<String> examples,
    List<String> counterexamples,
    String intent,
    String alternative,
    List<Alternative> alternatives,
    boolean excludeComments,
    boolean override,
    String category,
    String codeExample
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public Constraint {
        Objects.requireNonNull(rule, "rule must not be null");
        value = normalizeValue(value);
        severity = severity != null ? severity : Severity.ERROR;
        source = source != null ? source : "";
        unless = unless != null ? List.copyOf(unless) : List.of();
        around = around != null ? List.copyOf(around) : List.of();
        before = before != null ? List.copyOf(before) : List.of();
        match = match != null ? match : MatchMode.ALL;
        examples = examples != null ? List.copyOf(examples) : List.of();
        counterexamples = counterexamples != null ? List.copyOf(counterexamples) : List.of();
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    /**
     * Shorthand for the common rule/value/severity triple.
     *
     * @param rule rule kind
     * @param value rule value
     * @param severity severity
     * @return new constraint
     */
    public static Constraint of(String rule, Object value, Severity severity) {
        return builder(rule).value(value).severity(severity).build();
    }

    public static Builder builder(String rule) {
        return new Builder(rule);
    }

    /**
     * Returns a builder pre-populated with this constraint's fields.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Copy of this constraint carrying the given provenance.
     *
     * @param newSource architecture id or {@code mixin:<id>}
     * @return constraint with the new source
     */
    public Constraint withSource(String newSource) {
        return toBuilder().source(newSource).build();
    }

    // ==================== Value accessors ====================

    /**
     * Value rendered as a single string: lists are joined with ", ".
     *
     * @return string form, empty for a null value
     */
    public String valueAsString() {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    /**
     * Value as a list of strings; a scalar becomes a singleton list.
     *
     * @return string values, empty for null or map values
     */
    public List<String> valueAsList() {
        if (value == null || value instanceof Map<?, ?>) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(value));
    }

    /**
     * Value as an integer; numeric strings are accepted.
     *
     * @return parsed integer, empty if the value is not numeric
     */
    public Optional<Integer> valueAsInt() {
        if (value instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Value as a structured map.
     *
     * @return map value, empty map if the value is not a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> valueAsMap() {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    /**
     * Pattern payload, falling back to a string value.
     *
     * @return the {@code pattern} field, else the value when it is a string
     */
    public Optional<String> patternOrValue() {
        if (pattern != null && !pattern.isEmpty()) {
            return Optional.of(pattern);
        }
        if (value instanceof String text) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    /**
     * Key identifying the (rule, value) slot this constraint occupies during resolution.
     *
     * @return slot key
     */
    public String slotKey() {
        return rule + ":" + slotValue(value);
    }

    private static String slotValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).sorted().toList().toString();
        }
        return String.valueOf(value);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        return value;
    }

    /**
     * Fluent builder for constraints.
     */
    public static final class Builder {
        private final String rule;
        private Object value;
        private Severity severity = Severity.ERROR;
        private String why;
        private String source;
        private ConstraintCondition when;
        private List<String> unless;
        private String appliesWhen;
        private String pattern;
        private List<String> around;
        private List<String> before;
        private MatchMode match;
        private NamingSpec naming;
        private List<String> examples;
        private List<String> counterexamples;
        private String intent;
        private String alternative;
        private List<Alternative> alternatives;
        private boolean excludeComments;
        private boolean override;
        private String category;
        private String codeExample;

        private Builder(String rule) {
            this.rule = rule;
        }

        private Builder(Constraint c) {
            this.rule = c.rule;
            this.value = c.value;
            this.severity = c.severity;
            this.why = c.why;
            this.source = c.source;
            this.when = c.when;
            this.unless = c.unless;
            this.appliesWhen = c.appliesWhen;
            this.pattern = c.pattern;
            this.around = c.around;
            this.before = c.before;
            this.match = c.match;
            this.naming = c.naming;
            this.examples = c.examples;
            this.counterexamples = c.counterexamples;
            this.intent = c.intent;
            this.alternative = c.alternative;
            this.alternatives = c.alternatives;
            this.excludeComments = c.excludeComments;
            this.override = c.override;
            this.category = c.category;
            this.codeExample = c.codeExample;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder why(String why) {
            this.why = why;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder when(ConstraintCondition when) {
            this.when = when;
            return this;
        }

        public Builder unless(List<String> unless) {
            this.unless = unless;
            return this;
        }

        public Builder appliesWhen(String appliesWhen) {
            this.appliesWhen = appliesWhen;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder around(List<String> around) {
            this.around = around;
            return this;
        }

        public Builder before(List<String> before) {
            this.before = before;
            return this;
        }

        public Builder match(MatchMode match) {
            this.match = match;
            return this;
        }

        public Builder naming(NamingSpec naming) {
            this.naming = naming;
            return this;
        }

        public Builder examples(List<String> examples) {
            this.examples = examples;
            return this;
        }

        public Builder counterexamples(List<String> counterexamples) {
            this.counterexamples = counterexamples;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public Builder alternative(String alternative) {
            this.alternative = alternative;
            return this;
        }

        public Builder alternatives(List<Alternative> alternatives) {
            this.alternatives = alternatives;
            return this;
        }

        public Builder excludeComments(boolean excludeComments) {
            this.excludeComments = excludeComments;
            return this;
        }

        public Builder override(boolean override) {
            this.override = override;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder codeExample(String codeExample) {
            this.codeExample = codeExample;
            return this;
        }

        public Constraint build() {
            return new Constraint(rule, value, severity, why, source, when, unless, appliesWhen, pattern,
                around, before, match, naming, examples, counterexamples, intent, alternative, alternatives,
                excludeComments, override, category, codeExample);
        }
    }
}
