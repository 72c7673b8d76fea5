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

/**
 * {@code require_try_catch}: calls matching {@code around} (or the value) sit inside a try block.
 *
 * @since 1.0.0
 */
public class RequireTryCatchValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_try_catch";
    }

    @Override
    public String getErrorCode() {
        return "E015";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> patterns = constraint.around().isEmpty() ? constraint.valueAsList() : constraint.around();
        List<Violation> violations = new ArrayList<>();
        for (FunctionCallInfo call : context.parsedFile().functionCalls()) {
            if (call.controlFlow().inTryBlock()
                    || patterns.stream().noneMatch(p -> GlobPatterns.matchesDotted(p, call.callee()))) {
                continue;
            }
            violations.add(violation(constraint, context)
                .line(call.location().line())
                .column(call.location().column())
                .message("Call to '" + call.callee() + "' must be wrapped in try/catch")
                .fixHint("Wrap the call to '" + call.callee() + "' in a try/catch block and handle the failure")
                .build());
        }
        return outcome(violations);
    }
}
