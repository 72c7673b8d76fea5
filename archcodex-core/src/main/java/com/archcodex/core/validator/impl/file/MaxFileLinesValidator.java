package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.Optional;

/**
 * {@code max_file_lines}: the file stays within the line limit; a file exactly at the limit passes.
 *
 * <p>With {@code excludeComments} the limit applies to lines of code instead of raw lines.
 *
 * @since 1.0.0
 */
public class MaxFileLinesValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "max_file_lines";
    }

    @Override
    public String getErrorCode() {
        return "E010";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Optional<Integer> limit = constraint.valueAsInt();
        if (limit.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("max_file_lines requires a numeric value, got '" + constraint.valueAsString() + "'")
                .fixHint("Set the constraint value to a number")
                .build());
        }
        String unit = constraint.excludeComments() ? "lines of code" : "lines";
        int actual = constraint.excludeComments() ? context.parsedFile().locCount() : context.parsedFile().lineCount();
        if (actual <= limit.get()) {
            return ValidationOutcome.pass();
        }
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("File has " + actual + " " + unit + "; maximum is " + limit.get())
            .fixHint("Split the file so that it stays within " + limit.get() + " " + unit)
            .build());
    }
}
