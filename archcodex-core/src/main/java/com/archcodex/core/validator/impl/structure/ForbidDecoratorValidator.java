package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.Capability;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.DecoratorInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractForbidValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code forbid_decorator}: no exported class carries the decorator.
 *
 * @since 1.0.0
 */
public class ForbidDecoratorValidator extends AbstractForbidValidator {

    @Override
    public String getRule() {
        return "forbid_decorator";
    }

    @Override
    public String getErrorCode() {
        return "E006";
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
                for (DecoratorInfo found : classInfo.decorators()) {
                    if (!found.name().equals(decorator)) {
                        continue;
                    }
                    violations.add(violation(constraint, context)
                        .line(found.location().line())
                        .column(found.location().column())
                        .message("Class '" + classInfo.name() + "' uses forbidden decorator '@" + decorator + "'")
                        .fixHint("Remove the '@" + decorator + "' decorator")
                        .suggestion(buildSuggestion(constraint, "@" + decorator))
                        .didYouMean(buildDidYouMean(constraint))
                        .build());
                }
            }
        }
        return outcome(violations);
    }
}
