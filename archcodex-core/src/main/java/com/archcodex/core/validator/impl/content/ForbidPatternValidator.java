package com.archcodex.core.validator.impl.content;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.util.SourcePatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractForbidValidator;
import com.archcodex.core.validator.support.ContentPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code forbid_pattern}: no match of the {@code pattern} field (or value) appears in the file.
 *
 * <p>Each match is reported separately at its own line; matches inside a function carrying an
 * exempting intent are skipped.
 *
 * @since 1.0.0
 */
public class ForbidPatternValidator extends AbstractForbidValidator {

    @Override
    public String getRule() {
        return "forbid_pattern";
    }

    @Override
    public String getErrorCode() {
        return "E013";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Optional<String> regex = constraint.patternOrValue();
        if (regex.isEmpty() || regex.get().isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("forbid_pattern constraint is missing 'pattern' field")
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
                .fixHint("Fix the regular expression in the forbid_pattern constraint")
                .build());
        }

        String content = context.content();
        List<Violation> violations = new ArrayList<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            int line = SourcePatterns.lineOf(content, matcher.start());
            if (isExemptByIntent(constraint, context, line)) {
                continue;
            }
            String matched = firstLine(matcher.group());
            violations.add(violation(constraint, context)
                .line(line)
                .column(SourcePatterns.columnOf(content, matcher.start()))
                .message("Forbidden pattern found: '" + matched + "'")
                .fixHint(constraint.alternative() != null
                    ? "Replace with '" + constraint.alternative() + "'"
                    : "Remove code matching '" + regex.get() + "'")
                .suggestion(buildSuggestion(constraint, matched))
                .didYouMean(buildDidYouMean(constraint))
                .build());
        }
        return outcome(violations);
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }
}
