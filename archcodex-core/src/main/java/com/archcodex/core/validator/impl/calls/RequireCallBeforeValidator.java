package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code require_call_before}: every call matching the value is preceded, within the same
 * function, by a call matching one of {@code before}.
 *
 * <p>Calls outside any function are compared against other top-level calls.
 *
 * @since 1.0.0
 */
public class RequireCallBeforeValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_call_before";
    }

    @Override
    public String getErrorCode() {
        return "E019";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> guarded = constraint.valueAsList();
        List<String> prerequisites = constraint.before();
        if (prerequisites.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("require_call_before requires a 'before' list of calls")
                .fixHint("Add the calls that must come first to 'before'")
                .build());
        }

        List<FunctionCallInfo> calls = context.parsedFile().functionCalls();
        List<Violation> violations = new ArrayList<>();
        for (FunctionCallInfo call : calls) {
            if (guarded.stream().noneMatch(p -> GlobPatterns.matchesDotted(p, call.callee()))) {
                continue;
            }
            boolean preceded = calls.stream()
                .filter(other -> Objects.equals(other.parentFunction(), call.parentFunction()))
                .filter(other -> other.location().line() < call.location().line())
                .anyMatch(other -> prerequisites.stream().anyMatch(p -> GlobPatterns.matchesDotted(p, other.callee())));
            if (!preceded) {
                String scope = call.parentFunction() != null ? " in '" + call.parentFunction() + "'" : "";
                violations.add(violation(constraint, context)
                    .line(call.location().line())
                    .column(call.location().column())
                    .message("Call to '" + call.callee() + "'" + scope + " must be preceded by one of: "
                        + quoteAll(prerequisites))
                    .fixHint(constraint.codeExample() != null
                        ? "Call " + String.join(" or ", prerequisites) + " first, e.g.\n" + constraint.codeExample()
                        : "Call " + String.join(" or ", prerequisites) + " before '" + call.callee() + "'")
                    .build());
            }
        }
        return outcome(violations);
    }
}
