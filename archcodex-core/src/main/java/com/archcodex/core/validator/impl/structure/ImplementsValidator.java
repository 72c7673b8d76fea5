package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
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
 * {@code implements}: every exported class lists the required interface.
 *
 * @since 1.0.0
 */
public class ImplementsValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "implements";
    }

    @Override
    public String getErrorCode() {
        return "E002";
    }

    @Override
    public Set<Capability> getRequiredCapabilities() {
        return Set.of(Capability.INTERFACES);
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        String required = stripGenerics(constraint.valueAsString());
        List<Violation> violations = new ArrayList<>();

        for (ClassInfo classInfo : context.parsedFile().exportedClasses()) {
            boolean implemented = classInfo.implementsInterfaces().stream().anyMatch(i -> sameType(i, required));
            if (!implemented) {
                violations.add(violation(constraint, context)
                    .line(classInfo.location().line())
                    .column(classInfo.location().column())
                    .message("Class '" + classInfo.name() + "' must implement '" + required + "'")
                    .fixHint("Add 'implements " + required + "' to the class declaration")
                    .build());
            }
        }
        return outcome(violations);
    }
}
