package com.archcodex.core.validator;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.semantic.Capability;

import java.util.Set;

/**
 * Evaluates one rule kind against a file's semantic model.
 *
 * <p>Validators are discovered via Java Service Provider Interface (SPI) and keyed by
 * {@link #getRule()}. Implementations must be stateless apart from memoization derived from the
 * constraint (such as a compiled pattern) and must copy severity and source from the constraint.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.archcodex.core.validator.ConstraintValidator}
 *
 * @see ValidatorRegistry
 * @since 1.0.0
 */
public interface ConstraintValidator {

    /**
     * Rule kind handled by this validator, e.g. {@code must_extend}.
     *
     * @return rule name
     */
    String getRule();

    /**
     * Stable code placed on every violation, e.g. {@code E001}.
     *
     * @return error code
     */
    String getErrorCode();

    /**
     * Language capabilities this rule needs.
     *
     * <p>When the file's adapter lacks one of them the rule is inapplicable and is not run.
     *
     * @return required capabilities, empty for rules that work on any language
     */
    default Set<Capability> getRequiredCapabilities() {
        return Set.of();
    }

    /**
     * Evaluates the constraint.
     *
     * @param constraint resolved constraint
     * @param context evaluation scope
     * @return outcome with violations, never null
     */
    ValidationOutcome validate(Constraint constraint, ConstraintContext context);
}
