package com.archcodex.core.config;

import com.archcodex.core.model.Severity;
import com.archcodex.core.validator.ConstraintContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for ArchCodex validation.
 *
 * <p>Loaded from {@code archcodex.yaml} in the project root. Every section and field is optional;
 * missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * validation:
 *   strict: false
 *   untaggedPolicy: warn
 *   skipRules: [max_similarity]
 *   requireWhyForForbid: true
 *   concurrency: 4
 *
 * overrides:
 *   requireReason: true
 *   maxExpiryDays: 180
 *   warnNoExpiry: true
 *   failOnExpired: true
 *   maxOverridesPerFile: 3
 *
 * files:
 *   testPatterns:
 *     - "**\/*.test.*"
 *     - "**\/*Test.java"
 * }</pre>
 *
 * @param validation validation behaviour
 * @param overrides override governance
 * @param files file classification
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchCodexConfig(
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("overrides") OverrideSettings overrides,
    @JsonProperty("files") FileSettings files
) {
    public ArchCodexConfig {
        validation = validation != null ? validation : ValidationSettings.defaults();
        overrides = overrides != null ? overrides : OverrideSettings.defaults();
        files = files != null ? files : FileSettings.defaults();
    }

    /**
     * Default configuration: warn on untagged files, require override reasons, no limits.
     *
     * @return default configuration
     */
    public static ArchCodexConfig defaults() {
        return new ArchCodexConfig(null, null, null);
    }

    /**
     * What to do with files that carry no {@code @arch} tag.
     */
    public enum UntaggedPolicy {
        /** Pass without violations */
        ALLOW,
        /** Report S001 as a warning */
        WARN,
        /** Report S001 as an error */
        DENY
    }

    /**
     * Validation behaviour.
     *
     * @param strict fold warnings into violations
     * @param untaggedPolicy handling of untagged files
     * @param skipRules rules never evaluated
     * @param severities severities kept in results; empty keeps all
     * @param requireWhyForForbid report forbid rules declared without a {@code why} (C001)
     * @param concurrency worker count for batch validation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("strict") boolean strict,
        @JsonProperty("untaggedPolicy") UntaggedPolicy untaggedPolicy,
        @JsonProperty("skipRules") List<String> skipRules,
        @JsonProperty("severities") List<Severity> severities,
        @JsonProperty("requireWhyForForbid") boolean requireWhyForForbid,
        @JsonProperty("concurrency") Integer concurrency
    ) {
        public ValidationSettings {
            untaggedPolicy = untaggedPolicy != null ? untaggedPolicy : UntaggedPolicy.WARN;
            skipRules = skipRules != null ? List.copyOf(skipRules) : List.of();
            severities = severities != null ? List.copyOf(severities) : List.of();
            concurrency = concurrency != null && concurrency > 0
                ? concurrency : Math.max(1, Runtime.getRuntime().availableProcessors());
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(false, null, null, null, false, null);
        }

        /**
         * Whether violations of the given severity are kept.
         *
         * @param severity violation severity
         * @return true when no filter is set or the severity is listed
         */
        public boolean includes(Severity severity) {
            return severities.isEmpty() || severities.contains(severity);
        }
    }

    /**
     * Override governance.
     *
     * @param requireReason an override without {@code @reason} is invalid (O001)
     * @param maxExpiryDays furthest allowed expiry from today, null for no limit (O004)
     * @param warnNoExpiry warn on overrides without {@code @expires}
     * @param failOnExpired expired overrides are errors instead of warnings (O002)
     * @param maxOverridesPerFile most overrides allowed in one file, null for no limit (O005)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OverrideSettings(
        @JsonProperty("requireReason") Boolean requireReason,
        @JsonProperty("maxExpiryDays") Integer maxExpiryDays,
        @JsonProperty("warnNoExpiry") boolean warnNoExpiry,
        @JsonProperty("failOnExpired") boolean failOnExpired,
        @JsonProperty("maxOverridesPerFile") Integer maxOverridesPerFile
    ) {
        public OverrideSettings {
            requireReason = requireReason != null ? requireReason : Boolean.TRUE;
        }

        public static OverrideSettings defaults() {
            return new OverrideSettings(true, null, false, false, null);
        }
    }

    /**
     * File classification.
     *
     * @param testPatterns globs identifying test files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileSettings(
        @JsonProperty("testPatterns") List<String> testPatterns
    ) {
        public FileSettings {
            testPatterns = testPatterns != null && !testPatterns.isEmpty()
                ? List.copyOf(testPatterns) : ConstraintContext.DEFAULT_TEST_FILE_PATTERNS;
        }

        public static FileSettings defaults() {
            return new FileSettings(null);
        }
    }
}
