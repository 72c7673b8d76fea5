package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.MatchMode;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code require_import}: the listed imports are present.
 *
 * <p>A requirement is satisfied by a module specifier (exact or subpath), a named import or a
 * default import. With {@code match: any} one satisfied requirement is enough; the default
 * {@code match: all} reports each missing one.
 *
 * @since 1.0.0
 */
public class RequireImportValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_import";
    }

    @Override
    public String getErrorCode() {
        return "E004";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> required = constraint.valueAsList();
        List<ImportInfo> imports = context.parsedFile().imports();
        List<String> missing = required.stream().filter(r -> !isImported(r, imports)).toList();

        if (constraint.match() == MatchMode.ANY) {
            if (required.isEmpty() || missing.size() < required.size()) {
                return ValidationOutcome.pass();
            }
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("None of the required imports found: " + quoteAll(required))
                .fixHint("Import at least one of: " + String.join(", ", required))
                .suggestion(Suggestion.add(required.get(0)))
                .build());
        }

        List<Violation> violations = new ArrayList<>();
        for (String module : missing) {
            violations.add(violation(constraint, context)
                .line(1)
                .column(1)
                .message("Missing required import '" + module + "'")
                .fixHint("Add an import of '" + module + "'")
                .suggestion(Suggestion.add(module))
                .build());
        }
        return outcome(violations);
    }

    private static boolean isImported(String required, List<ImportInfo> imports) {
        for (ImportInfo importInfo : imports) {
            if (matchesModule(importInfo.moduleSpecifier(), required)
                    || importInfo.namedImports().contains(required)
                    || required.equals(importInfo.defaultImport())) {
                return true;
            }
        }
        return false;
    }
}
