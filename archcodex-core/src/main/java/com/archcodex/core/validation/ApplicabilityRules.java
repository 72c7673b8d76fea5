package com.archcodex.core.validation;

import com.archcodex.core.validator.ConstraintValidator;

/**
 * Factory for the applicability checks the orchestrator applies before running a validator.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ConstraintApplicability applicability = ApplicabilityRules.standard(validator);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ApplicabilityRules {

    private ApplicabilityRules() {
        // Utility class - prevent instantiation
    }

    // ===== Language Capabilities =====

    /**
     * The file's language offers every capability the validator needs.
     *
     * @param validator validator about to run
     * @return check on the context's capabilities
     */
    public static ConstraintApplicability capabilitiesSupported(ConstraintValidator validator) {
        return (constraint, context) -> context.capabilities().supportsAll(validator.getRequiredCapabilities());
    }

    // ===== Conditional Clauses =====

    /**
     * The constraint's {@code when} condition holds, or it has none.
     *
     * @return check on {@code when}
     */
    public static ConstraintApplicability whenSatisfied() {
        return (constraint, context) -> ConditionEvaluator.evaluate(constraint.when(), context.parsedFile());
    }

    /**
     * No {@code unless} entry exempts the file.
     *
     * @return check on {@code unless}
     */
    public static ConstraintApplicability notExempted() {
        return (constraint, context) -> !ConditionEvaluator.isExempt(constraint.unless(), context);
    }

    /**
     * The {@code applies_when} pattern matches the content, or there is none.
     *
     * <p>An invalid pattern throws {@link com.archcodex.core.exception.InvalidConstraintException}
     * so the caller can report it.
     *
     * @return check on {@code applies_when}
     */
    public static ConstraintApplicability appliesWhenMatched() {
        return (constraint, context) -> ConditionEvaluator.appliesWhen(constraint.appliesWhen(), context.content());
    }

    // ===== Composite =====

    /**
     * Every check above, cheapest first.
     *
     * @param validator validator about to run
     * @return combined check
     */
    public static ConstraintApplicability standard(ConstraintValidator validator) {
        return capabilitiesSupported(validator)
            .and(whenSatisfied())
            .and(notExempted())
            .and(appliesWhenMatched());
    }
}
