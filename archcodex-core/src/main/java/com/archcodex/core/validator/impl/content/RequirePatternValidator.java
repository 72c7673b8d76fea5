package com.archcodex.core.validator.impl.content;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;
import com.archcodex.core.validator.support.ContentPatterns;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code require_pattern}: the file content contains a match for the {@code pattern} field (or value).
 *
 * @since 1.0.0
 */
public class RequirePatternValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_pattern";
    }

    @Override
    public String getErrorCode() {
        return "E012";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Optional<String> regex = constraint.patternOrValue();
        if (regex.isEmpty() || regex.get().isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("require_pattern constraint is missing 'pattern' field")
                .fixHint("Add a 'pattern' regex to the constraint")
                .build());
        }
        Pattern pattern;
        try {
            pattern = ContentPatterns.multiline(regex.get());
        } catch (PatternSyntaxException e) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("Invalid regex pattern '" + regex.get() + "': " + e.getDescription())
                .fixHint("Fix the regular expression in the require_pattern constraint")
                .build());
        }
        if (pattern.matcher(context.content()).find()) {
            return ValidationOutcome.pass();
        }
        String label = constraint.valueAsString().isEmpty() || constraint.valueAsString().equals(regex.get())
            ? "'" + regex.get() + "'"
            : constraint.valueAsString() + " ('" + regex.get() + "')";
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("Required pattern not found: " + label)
            .fixHint(constraint.codeExample() != null
                ? "Add code matching the pattern, e.g. " + constraint.codeExample()
                : "Add code matching the pattern '" + regex.get() + "'")
            .build());
    }
}
