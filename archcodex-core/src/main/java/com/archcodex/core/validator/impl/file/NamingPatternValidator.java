package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.NamingCase;
import com.archcodex.core.model.NamingSpec;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;
import com.archcodex.core.validator.support.NamingPatternCompiler;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code naming_pattern}: the file name matches a raw regex or a structured naming spec.
 *
 * <p>The structured spec comes from the {@code naming} field, or from a map value with
 * {@code case}, {@code prefix}, {@code suffix} and {@code extension} keys. When the naming spec names no
 * extension the name is matched without its extension. A raw regex is searched anywhere in the
 * file name, so it should carry its own anchors.
 *
 * @since 1.0.0
 */
public class NamingPatternValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "naming_pattern";
    }

    @Override
    public String getErrorCode() {
        return "E007";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        NamingSpec spec = constraint.naming();
        if (spec == null && constraint.value() instanceof Map<?, ?>) {
            // a map value is always a structured spec, even when it sets nothing
            spec = specFromMap(constraint.valueAsMap());
        }
        if (spec != null) {
            return validateStructured(constraint, context, spec);
        }
        return validateRegex(constraint, context, constraint.valueAsString());
    }

    private ValidationOutcome validateStructured(Constraint constraint, ConstraintContext context, NamingSpec spec) {
        Optional<String> error = NamingPatternCompiler.validate(spec);
        if (error.isPresent()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("Invalid structured naming pattern: " + error.get())
                .fixHint("Set at least one of case, prefix, suffix or extension on the naming spec")
                .build());
        }
        String subject = spec.extension() == null || spec.extension().isEmpty()
            ? baseNameOf(context.fileName()) : context.fileName();
        if (NamingPatternCompiler.compile(spec).matcher(subject).matches()) {
            return ValidationOutcome.pass();
        }
        String description = NamingPatternCompiler.describe(spec);
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("File name '" + context.fileName() + "' does not match naming pattern: " + description
                + examplesOf(constraint))
            .fixHint("Rename the file to match " + description + examplesOf(constraint))
            .build());
    }

    private ValidationOutcome validateRegex(Constraint constraint, ConstraintContext context, String regex) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("Invalid naming pattern regex '" + regex + "': " + e.getDescription())
                .fixHint("Fix the regular expression in the naming_pattern constraint")
                .build());
        }
        if (pattern.matcher(context.fileName()).find()) {
            return ValidationOutcome.pass();
        }
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("File name '" + context.fileName() + "' does not match pattern '" + regex + "'"
                + examplesOf(constraint))
            .fixHint("Rename the file to match the pattern '" + regex + "'" + examplesOf(constraint))
            .build());
    }

    private static String examplesOf(Constraint constraint) {
        return constraint.examples().isEmpty() ? "" : " (e.g. " + String.join(", ", constraint.examples()) + ")";
    }

    private static NamingSpec specFromMap(Map<String, Object> map) {
        NamingCase caseStyle = Optional.ofNullable(map.get("case"))
            .map(String::valueOf)
            .flatMap(NamingCase::fromLabel)
            .orElse(null);
        return new NamingSpec(caseStyle, stringOrNull(map.get("prefix")), stringOrNull(map.get("suffix")),
            stringOrNull(map.get("extension")));
    }

    private static String stringOrNull(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
