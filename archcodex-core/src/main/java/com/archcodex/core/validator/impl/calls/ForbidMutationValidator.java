package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.MutationInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractForbidValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code forbid_mutation}: listed objects are never assigned to, updated or deleted from.
 *
 * <p>Target patterns:
 * <ul>
 *   <li>{@code window}: the object itself or anything under it</li>
 *   <li>{@code process.env}: the path and anything under it</li>
 *   <li>{@code config.*}: direct properties only</li>
 *   <li>{@code state.**}: properties at any depth</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ForbidMutationValidator extends AbstractForbidValidator {

    @Override
    public String getRule() {
        return "forbid_mutation";
    }

    @Override
    public String getErrorCode() {
        return "E016";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> patterns = constraint.valueAsList();
        List<Violation> violations = new ArrayList<>();
        for (MutationInfo mutation : context.parsedFile().mutations()) {
            if (patterns.stream().noneMatch(p -> matches(p, mutation))) {
                continue;
            }
            int line = mutation.location().line();
            if (isExemptByIntent(constraint, context, line)) {
                continue;
            }
            String verb = mutation.isDelete() ? "Delete of" : "Mutation of";
            violations.add(violation(constraint, context)
                .line(line)
                .column(mutation.location().column())
                .message(verb + " '" + mutation.target() + "' is forbidden")
                .fixHint(constraint.alternative() != null
                    ? "Replace with '" + constraint.alternative() + "'"
                    : "Treat '" + mutation.target() + "' as read-only; copy it or pass new values explicitly")
                .suggestion(buildSuggestion(constraint, mutation.rawText()))
                .didYouMean(buildDidYouMean(constraint))
                .build());
        }
        return outcome(violations);
    }

    static boolean matches(String pattern, MutationInfo mutation) {
        String target = mutation.target();
        if (pattern.endsWith(".**")) {
            String base = pattern.substring(0, pattern.length() - 3);
            return target.startsWith(base + ".");
        }
        if (pattern.endsWith(".*")) {
            String base = pattern.substring(0, pattern.length() - 2);
            return target.startsWith(base + ".") && target.indexOf('.', base.length() + 1) < 0;
        }
        if (target.equals(pattern) || target.startsWith(pattern + ".")) {
            return true;
        }
        return !pattern.contains(".") && pattern.equals(mutation.rootObject());
    }
}
