package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code require_export}: the file exports a symbol matching each listed name; {@code *} matches any
 * run of characters, so {@code *Service} accepts {@code PaymentService}.
 *
 * @since 1.0.0
 */
public class RequireExportValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_export";
    }

    @Override
    public String getErrorCode() {
        return "E018";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> exported = context.parsedFile().exports().stream().map(ExportInfo::name).toList();
        List<Violation> violations = new ArrayList<>();

        for (String required : constraint.valueAsList()) {
            Pattern pattern = toPattern(required);
            if (exported.stream().noneMatch(name -> pattern.matcher(name).matches())) {
                violations.add(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("Missing required export '" + required + "'"
                        + (exported.isEmpty() ? " (file exports nothing)" : " (exports: " + String.join(", ", exported) + ")"))
                    .fixHint("Export a symbol matching '" + required + "' from this file")
                    .suggestion(Suggestion.add(required))
                    .build());
            }
        }
        return outcome(violations);
    }

    private static Pattern toPattern(String glob) {
        List<String> parts = new ArrayList<>();
        for (String part : glob.split("\\*", -1)) {
            parts.add(part.isEmpty() ? "" : Pattern.quote(part));
        }
        return Pattern.compile(String.join(".*", parts));
    }
}
