package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Alternative;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractForbidValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * {@code forbid_import}: none of the listed modules (or their subpaths) is imported.
 *
 * <p>Each offending import yields one violation at the import's position. Approved alternatives
 * feed the fix hint, a replace suggestion and a "did you mean" pointer.
 *
 * @since 1.0.0
 */
public class ForbidImportValidator extends AbstractForbidValidator {

    private static final Pattern LAYER_MODULE =
        Pattern.compile("(^|[/@.])(layer|layers|platform|infrastructure|infra|adapter|adapters)([/.]|$)");

    @Override
    public String getRule() {
        return "forbid_import";
    }

    @Override
    public String getErrorCode() {
        return "E003";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> forbidden = constraint.valueAsList();
        List<Violation> violations = new ArrayList<>();

        for (ImportInfo importInfo : context.parsedFile().imports()) {
            String specifier = importInfo.moduleSpecifier();
            for (String pattern : forbidden) {
                if (!matchesModule(specifier, pattern)) {
                    continue;
                }
                String kind = importInfo.dynamic() ? "Dynamic import" : "Import";
                violations.add(violation(constraint, context)
                    .line(importInfo.location().line())
                    .column(importInfo.location().column())
                    .message(kind + " '" + specifier + "' is forbidden (from " + sourceOf(constraint, context) + ")")
                    .fixHint(fixHint(constraint, specifier))
                    .suggestion(buildSuggestion(constraint, specifier))
                    .didYouMean(buildDidYouMean(constraint))
                    .build());
                break;
            }
        }
        return outcome(violations);
    }

    private String fixHint(Constraint constraint, String specifier) {
        if (!constraint.alternatives().isEmpty()) {
            return "Use an approved alternative: "
                + String.join(", ", constraint.alternatives().stream().map(Alternative::module).toList());
        }
        if (constraint.alternative() != null) {
            return "Use the approved alternative: " + constraint.alternative();
        }
        if (LAYER_MODULE.matcher(specifier.toLowerCase(Locale.ROOT)).find()) {
            return "Receive '" + specifier + "' through dependency injection instead of importing it directly";
        }
        return "Remove the import or use an approved alternative";
    }
}
