package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.Capability;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code must_extend}: every exported class extends the required base, directly or through its
 * resolved inheritance chain.
 *
 * <p>A class without any base and a class extending the wrong base are reported with different
 * wording. Generic arguments are ignored on both sides.
 *
 * @since 1.0.0
 */
public class MustExtendValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "must_extend";
    }

    @Override
    public String getErrorCode() {
        return "E001";
    }

    @Override
    public Set<Capability> getRequiredCapabilities() {
        return Set.of(Capability.CLASS_INHERITANCE);
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        String required = stripGenerics(constraint.valueAsString());
        List<Violation> violations = new ArrayList<>();

        for (ClassInfo classInfo : context.parsedFile().exportedClasses()) {
            if (classInfo.extendsClass() == null) {
                violations.add(violation(constraint, context, classInfo, required,
                    "Class '" + classInfo.name() + "' has no base class; must extend '" + required + "'"));
                continue;
            }
            boolean extendsRequired = sameType(classInfo.extendsClass(), required)
                || classInfo.inheritanceChain().stream().anyMatch(ancestor -> sameType(ancestor, required));
            if (!extendsRequired) {
                violations.add(violation(constraint, context, classInfo, required,
                    "Class '" + classInfo.name() + "' must extend '" + required + "' (found '"
                        + stripGenerics(classInfo.extendsClass()) + "')"));
            }
        }
        return outcome(violations);
    }

    private Violation violation(Constraint constraint, ConstraintContext context, ClassInfo classInfo,
                                String required, String message) {
        return violation(constraint, context)
            .line(classInfo.location().line())
            .column(classInfo.location().column())
            .message(message)
            .fixHint("Add 'extends " + required + "' to the class declaration")
            .suggestion(new Suggestion(Suggestion.Action.ADD, classInfo.name(), "extends " + required, null))
            .build();
    }
}
