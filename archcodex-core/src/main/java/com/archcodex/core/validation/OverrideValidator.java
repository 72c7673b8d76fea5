package com.archcodex.core.validation;

import com.archcodex.core.config.ArchCodexConfig.OverrideSettings;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.tag.OverrideAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks the in-file {@code @override} annotations of a file and matches them to violations.
 *
 * <p>Issues:
 * <ul>
 *   <li>O001: no {@code @reason} (when reasons are required)</li>
 *   <li>O002: expired; an error with {@code failOnExpired}, a warning otherwise</li>
 *   <li>O003: {@code @expires} is not a {@code YYYY-MM-DD} date</li>
 *   <li>O004: expiry further out than {@code maxExpiryDays}</li>
 *   <li>O005: more overrides than {@code maxOverridesPerFile}</li>
 *   <li>O006: no {@code @expires}, a warning when {@code warnNoExpiry} is set</li>
 * </ul>
 * Only overrides without error-level issues that have not expired become active.
 *
 * <p>Dates are compared against the injected {@link Clock}, so results are reproducible.
 *
 * @since 1.0.0
 */
public class OverrideValidator {

    private static final Logger log = LoggerFactory.getLogger(OverrideValidator.class);

    static final String OVERRIDE_RULE = "override";
    static final String OVERRIDE_LIMIT_RULE = "override_limit";
    static final String WILDCARD = "*";

    private final OverrideSettings settings;
    private final Clock clock;

    public OverrideValidator(OverrideSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Valid overrides and the issues found in all of them.
     *
     * @param active overrides in force, in declaration order
     * @param issues override problems as violations
     */
    public record Evaluation(List<ActiveOverride> active, List<Violation> issues) {
        public Evaluation {
            active = active != null ? List.copyOf(active) : List.of();
            issues = issues != null ? List.copyOf(issues) : List.of();
        }
    }

    /**
     * Checks every override of one file.
     *
     * @param overrides overrides in declaration order
     * @return active overrides and issues
     */
    public Evaluation evaluate(List<OverrideAnnotation> overrides) {
        List<ActiveOverride> active = new ArrayList<>();
        List<Violation> issues = new ArrayList<>();
        LocalDate today = LocalDate.now(clock);

        for (OverrideAnnotation override : overrides) {
            boolean valid = true;
            if (Boolean.TRUE.equals(settings.requireReason()) && isBlank(override.reason())) {
                issues.add(issue("O001", Severity.ERROR, override,
                    "Override of " + target(override) + " has no @reason"));
                valid = false;
            }
            if (isBlank(override.expires())) {
                if (settings.warnNoExpiry()) {
                    issues.add(issue("O006", Severity.WARNING, override,
                        "Override of " + target(override) + " has no @expires date"));
                }
            } else {
                valid &= checkExpiry(override, today, issues);
            }
            if (valid) {
                active.add(new ActiveOverride(override.rule(), override.value().trim(), override.reason(),
                    override.expires(), override.ticket(), override.approvedBy(), override.line(), 0));
            } else {
                log.warn("Ignoring invalid override {} at line {}", target(override), override.line());
            }
        }

        Integer limit = settings.maxOverridesPerFile();
        if (limit != null && overrides.size() > limit) {
            issues.add(Violation.builder("O005", OVERRIDE_LIMIT_RULE, Severity.ERROR)
                .value(overrides.size())
                .line(overrides.get(limit).line())
                .column(1)
                .message("File has " + overrides.size() + " overrides, maximum is " + limit)
                .fixHint("Fix the underlying violations instead of overriding them")
                .source(OVERRIDE_RULE)
                .build());
        }
        return new Evaluation(active, issues);
    }

    private boolean checkExpiry(OverrideAnnotation override, LocalDate today, List<Violation> issues) {
        LocalDate expiry;
        try {
            expiry = LocalDate.parse(override.expires().trim());
        } catch (DateTimeParseException e) {
            issues.add(issue("O003", Severity.ERROR, override,
                "Invalid expiry date format: " + override.expires() + " (expected YYYY-MM-DD)"));
            return false;
        }
        if (expiry.isBefore(today)) {
            issues.add(issue("O002", settings.failOnExpired() ? Severity.ERROR : Severity.WARNING, override,
                "Override of " + target(override) + " expired on " + override.expires()));
            return false;
        }
        Integer maxDays = settings.maxExpiryDays();
        if (maxDays != null && ChronoUnit.DAYS.between(today, expiry) > maxDays) {
            issues.add(issue("O004", Severity.ERROR, override,
                "Override expiry " + override.expires() + " exceeds maximum of " + maxDays + " days"));
            return false;
        }
        return true;
    }

    /**
     * Whether an active override covers a violation.
     *
     * <p>The rule must be equal. The value matches when it is {@code *}, equals the violation's
     * value, is a member of the violation's list value, or appears quoted in the message.
     *
     * @param override active override
     * @param violation violation to test
     * @return true on match
     */
    public static boolean matches(ActiveOverride override, Violation violation) {
        if (!override.rule().equals(violation.rule())) {
            return false;
        }
        String value = override.value();
        if (WILDCARD.equals(value)) {
            return true;
        }
        Object violationValue = violation.value();
        if (violationValue instanceof List<?> list) {
            if (list.stream().map(String::valueOf).anyMatch(value::equals)) {
                return true;
            }
        } else if (violationValue != null && value.equals(String.valueOf(violationValue))) {
            return true;
        }
        return violation.message() != null && violation.message().contains("'" + value + "'");
    }

    private static Violation issue(String code, Severity severity, OverrideAnnotation override, String message) {
        return Violation.builder(code, override.rule(), severity)
            .value(override.value())
            .line(override.line())
            .column(1)
            .message(message)
            .fixHint(fixHintFor(code))
            .source(OVERRIDE_RULE)
            .build();
    }

    private static String fixHintFor(String code) {
        return switch (code) {
            case "O001" -> "Add '@reason <why this exception is needed>' below the @override tag";
            case "O002" -> "Remove the override and fix the violation, or renew it with a new @expires date";
            case "O003" -> "Write the expiry as '@expires YYYY-MM-DD'";
            case "O004" -> "Choose an earlier expiry date";
            case "O006" -> "Add '@expires YYYY-MM-DD' below the @override tag";
            default -> "Review the override";
        };
    }

    private static String target(OverrideAnnotation override) {
        return override.rule() + ":" + override.value().trim();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
