package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

/**
 * {@code location_pattern}: the file lives under the given directory prefix or matches the given glob.
 *
 * <p>A prefix such as {@code src/services/} matches at the start of the path or after any
 * directory separator, so absolute and project-relative paths behave the same.
 *
 * @since 1.0.0
 */
public class LocationPatternValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "location_pattern";
    }

    @Override
    public String getErrorCode() {
        return "E008";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        String location = constraint.valueAsString();
        String path = context.filePath().replace('\\', '/');
        if (location.isEmpty() || matches(location, path)) {
            return ValidationOutcome.pass();
        }
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("File '" + path + "' must be located in '" + location + "'")
            .fixHint("Move the file to '" + location + "'")
            .build());
    }

    private static boolean matches(String location, String path) {
        if (location.contains("*") || location.contains("?")) {
            return GlobPatterns.matchesPath(location, path)
                || (!location.startsWith("**/") && GlobPatterns.matchesPath("**/" + location, path));
        }
        String prefix = location.startsWith("./") ? location.substring(2) : location;
        return path.startsWith(prefix) || path.contains("/" + prefix);
    }
}
