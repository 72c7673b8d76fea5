package com.archcodex.core.validation;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.validator.ConstraintContext;

/**
 * Decides whether a resolved constraint is evaluated against a file.
 *
 * <p>Checks compose with {@link #and(ConstraintApplicability)}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ConstraintApplicability applicability =
 *     ApplicabilityRules.capabilitiesSupported(validator)
 *         .and(ApplicabilityRules.whenSatisfied())
 *         .and(ApplicabilityRules.notExempted());
 *
 * if (applicability.test(constraint, context)) {
 *     // run the validator
 * }
 * }</pre>
 *
 * @see ApplicabilityRules
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConstraintApplicability {

    /**
     * Check if the constraint applies to the file in the context.
     *
     * @param constraint resolved constraint
     * @param context evaluation scope of one file
     * @return {@code true} if the constraint should be evaluated
     */
    boolean test(Constraint constraint, ConstraintContext context);

    /**
     * Combine with another check using AND logic.
     *
     * @param other the other check
     * @return check that holds only if both hold
     */
    default ConstraintApplicability and(ConstraintApplicability other) {
        return (constraint, context) -> this.test(constraint, context) && other.test(constraint, context);
    }
}
