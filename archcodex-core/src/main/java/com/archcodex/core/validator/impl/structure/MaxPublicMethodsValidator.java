package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.semantic.Capability;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.Visibility;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.Optional;
import java.util.Set;

/**
 * {@code max_public_methods}: the public methods of all classes in the file stay within the limit.
 *
 * @since 1.0.0
 */
public class MaxPublicMethodsValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "max_public_methods";
    }

    @Override
    public String getErrorCode() {
        return "E009";
    }

    @Override
    public Set<Capability> getRequiredCapabilities() {
        return Set.of(Capability.VISIBILITY_MODIFIERS);
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Optional<Integer> limit = constraint.valueAsInt();
        if (limit.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("max_public_methods requires a numeric value, got '" + constraint.valueAsString() + "'")
                .fixHint("Set the constraint value to a number")
                .build());
        }

        long count = context.parsedFile().allMethods().stream()
            .filter(m -> m.visibility() == Visibility.PUBLIC)
            .count();
        if (count <= limit.get()) {
            return ValidationOutcome.pass();
        }

        int line = context.parsedFile().classes().stream()
            .findFirst()
            .map(ClassInfo::location)
            .map(l -> l.line())
            .orElse(1);
        return ValidationOutcome.fail(violation(constraint, context)
            .line(line)
            .column(1)
            .message("File has " + count + " public methods; maximum is " + limit.get())
            .fixHint("Reduce the number of public methods to " + limit.get()
                + " or fewer. Consider extracting methods to helper classes.")
            .build());
    }
}
