package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Alternative;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractForbidValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code forbid_call}: none of the listed callees is invoked.
 *
 * <p>Callee patterns are exact names, {@code a.*} (one segment), {@code a.**} (any depth) or
 * {@code /regex/}. Calls inside a function, or a file, carrying an intent listed in
 * {@code unless} as {@code @intent:name} are exempt.
 *
 * @since 1.0.0
 */
public class ForbidCallValidator extends AbstractForbidValidator {

    @Override
    public String getRule() {
        return "forbid_call";
    }

    @Override
    public String getErrorCode() {
        return "E014";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> patterns = constraint.valueAsList();
        List<Violation> violations = new ArrayList<>();
        for (FunctionCallInfo call : context.parsedFile().functionCalls()) {
            if (patterns.stream().noneMatch(p -> GlobPatterns.matchesDotted(p, call.callee()))) {
                continue;
            }
            int line = call.location().line();
            if (isExemptByIntent(constraint, context, line)) {
                log.debug("Call {} at {}:{} exempt by intent", call.callee(), context.filePath(), line);
                continue;
            }
            violations.add(violation(constraint, context)
                .line(line)
                .column(call.location().column())
                .message("Call to '" + call.callee() + "' is forbidden")
                .fixHint(fixHint(constraint, patterns))
                .suggestion(buildSuggestion(constraint, call.callee()))
                .didYouMean(buildDidYouMean(constraint))
                .build());
        }
        return outcome(violations);
    }

    private static String fixHint(Constraint constraint, List<String> patterns) {
        if (constraint.alternative() != null) {
            return "Replace with '" + constraint.alternative() + "'";
        }
        if (!constraint.alternatives().isEmpty()) {
            Alternative first = constraint.alternatives().get(0);
            return first.export() != null
                ? "Replace with '" + first.module() + "' (use " + first.export() + ")"
                : "Replace with '" + first.module() + "'";
        }
        return "Remove or replace the forbidden call(s): " + String.join(", ", patterns);
    }
}
