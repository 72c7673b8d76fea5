package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.MatchMode;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code require_call}: the file calls each listed callee ({@code match: all}, the default) or at
 * least one of them ({@code match: any}).
 *
 * @since 1.0.0
 */
public class RequireCallValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_call";
    }

    @Override
    public String getErrorCode() {
        return "E017";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> patterns = constraint.valueAsList();
        List<FunctionCallInfo> calls = context.parsedFile().functionCalls();

        if (constraint.match() == MatchMode.ANY) {
            if (patterns.isEmpty() || patterns.stream().anyMatch(p -> isCalled(p, calls))) {
                return ValidationOutcome.pass();
            }
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("None of the required calls found: " + quoteAll(patterns))
                .fixHint("Call one of: " + String.join(", ", patterns))
                .build());
        }

        List<Violation> violations = new ArrayList<>();
        for (String pattern : patterns) {
            if (!isCalled(pattern, calls)) {
                violations.add(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("Missing required call to '" + pattern + "'")
                    .fixHint("Add a call to '" + pattern + "'")
                    .suggestion(pattern.contains("*") || pattern.startsWith("/") ? null : Suggestion.add(pattern + "()"))
                    .build());
            }
        }
        return outcome(violations);
    }

    private static boolean isCalled(String pattern, List<FunctionCallInfo> calls) {
        return calls.stream().anyMatch(call -> GlobPatterns.matchesDotted(pattern, call.callee()));
    }
}
