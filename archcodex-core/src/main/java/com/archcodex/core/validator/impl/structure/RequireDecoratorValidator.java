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
 * {@code require_decorator}: every exported class carries the decorator (annotation in Java).
 *
 * @since 1.0.0
 */
public class RequireDecoratorValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_decorator";
    }

    @Override
    public String getErrorCode() {
        return "E005";
    }

    @Override
    public Set<Capability> getRequiredCapabilities() {
        return Set.of(Capability.DECORATORS);
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<Violation> violations = new ArrayList<>();
        for (String value : constraint.valueAsList()) {
            String decorator = DecoratorNames.bare(value);
            for (ClassInfo classInfo : context.parsedFile().exportedClasses()) {
                if (!classInfo.hasDecorator(decorator)) {
                    violations.add(violation(constraint, context)
                        .line(classInfo.location().line())
                        .column(classInfo.location().column())
                        .message("Class '" + classInfo.name() + "' is missing required decorator '@" + decorator + "'")
                        .fixHint("Add '@" + decorator + "' to the class declaration")
                        .suggestion(new Suggestion(Suggestion.Action.ADD, classInfo.name(), "@" + decorator, null))
                        .build());
                }
            }
        }
        return outcome(violations);
    }
}
