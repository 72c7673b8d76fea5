package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code require_test_file}: a companion test file exists.
 *
 * <p>Values are file name patterns where {@code *} stands for the base name, e.g.
 * {@code *.test.ts} or {@code __tests__/*.test.ts}, resolved against the file's directory. Without
 * a value the language convention is used: {@code XTest.java} (also under the mirrored
 * {@code src/test/java} tree), {@code test_x.py} / {@code x_test.py}, or {@code x.test.ext} /
 * {@code x.spec.ext}. Test files themselves are skipped.
 *
 * @since 1.0.0
 */
public class RequireTestFileValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_test_file";
    }

    @Override
    public String getErrorCode() {
        return "E011";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        if (isTestFile(context)) {
            return ValidationOutcome.pass();
        }
        List<String> candidates = candidates(constraint, context);
        if (candidates.stream().anyMatch(path -> fileExists(context, path))) {
            return ValidationOutcome.pass();
        }
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("Missing companion test file for '" + context.fileName() + "' (looked for: "
                + String.join(", ", candidates) + ")")
            .fixHint("Create " + candidates.get(0))
            .suggestion(Suggestion.add(candidates.get(0)))
            .build());
    }

    private static List<String> candidates(Constraint constraint, ConstraintContext context) {
        String directory = directoryOf(context.filePath());
        String baseName = baseNameOf(context.fileName());
        String extension = context.parsedFile().extension();

        // a boolean value means "use the language convention"
        List<String> patterns = new ArrayList<>();
        if (!(constraint.value() instanceof Boolean)) {
            patterns.addAll(constraint.valueAsList());
        }
        if (patterns.isEmpty()) {
            patterns.addAll(conventionFor(extension));
        }

        Set<String> candidates = new LinkedHashSet<>();
        for (String pattern : patterns) {
            String relative = pattern.replace("*", baseName);
            candidates.add(joinPath(directory, relative));
            if (directory.contains("src/main/")) {
                candidates.add(joinPath(directory.replace("src/main/", "src/test/"), relative));
            }
        }
        return List.copyOf(candidates);
    }

    private static List<String> conventionFor(String extension) {
        if (".java".equals(extension)) {
            return List.of("*Test.java", "*Tests.java");
        }
        if (".py".equals(extension)) {
            return List.of("test_*.py", "*_test.py", "tests/test_*.py");
        }
        return List.of("*.test" + extension, "*.spec" + extension);
    }
}
