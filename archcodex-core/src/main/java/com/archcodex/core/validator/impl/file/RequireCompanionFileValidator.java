package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.util.StringSimilarity;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code require_companion_file}: files that must accompany this one exist, and optionally
 * re-export it.
 *
 * <p>Each entry is a path template or a map {@code {path, mustExport}}; a list combines several.
 * Templates are resolved against the file's directory and support:
 * <ul>
 *   <li>{@code ${name}}: base name ({@code PaymentService})</li>
 *   <li>{@code ${name:kebab}}: kebab-case base name ({@code payment-service})</li>
 *   <li>{@code ${ext}}: extension without the dot</li>
 *   <li>{@code ${dir}}: name of the containing directory</li>
 * </ul>
 *
 * <p>Test files and the companion itself (a barrel such as {@code index.ts}) are skipped.
 *
 * @since 1.0.0
 */
public class RequireCompanionFileValidator extends AbstractConstraintValidator {

    @Override
    public String getRule() {
        return "require_companion_file";
    }

    @Override
    public String getErrorCode() {
        return "E022";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        if (isTestFile(context)) {
            return ValidationOutcome.pass();
        }
        List<Violation> violations = new ArrayList<>();
        for (Companion companion : companionsOf(constraint.value())) {
            String path = joinPath(directoryOf(context.filePath()), expand(companion.template(), context));
            String companionName = path.substring(path.lastIndexOf('/') + 1);
            if (companionName.equals(context.fileName())) {
                continue;
            }
            if (!fileExists(context, path)) {
                violations.add(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("Missing companion file '" + path + "' for '" + context.fileName() + "'")
                    .fixHint("Create " + path)
                    .suggestion(new Suggestion(Suggestion.Action.ADD, path, scaffold(companionName, context), null))
                    .build());
                continue;
            }
            if (companion.mustExport() && !exportsFrom(readFile(context, path), context)) {
                violations.add(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("Companion file '" + path + "' does not export from '" + context.fileName() + "'")
                    .fixHint("Re-export '" + baseNameOf(context.fileName()) + "' from " + path)
                    .suggestion(new Suggestion(Suggestion.Action.ADD, path, reexportLine(context), null))
                    .build());
            }
        }
        return outcome(violations);
    }

    // ==================== Templates ====================

    private static String expand(String template, ConstraintContext context) {
        String baseName = baseNameOf(context.fileName());
        String extension = context.parsedFile().extension().startsWith(".")
            ? context.parsedFile().extension().substring(1) : context.parsedFile().extension();
        String directory = directoryOf(context.filePath());
        String directoryName = directory.substring(directory.lastIndexOf('/') + 1);
        return template
            .replace("${name:kebab}", StringSimilarity.toKebabCase(baseName))
            .replace("${name}", baseName)
            .replace("${ext}", extension)
            .replace("${dir}", directoryName);
    }

    private static boolean exportsFrom(Optional<String> companionContent, ConstraintContext context) {
        if (companionContent.isEmpty()) {
            return false;
        }
        String baseName = Pattern.quote(baseNameOf(context.fileName()));
        Pattern reexport = Pattern.compile(
            "export\\s+(?:\\*|\\{[^}]*})\\s+from\\s+['\"]\\./" + baseName + "(?:\\.\\w+)?['\"]"
                + "|from\\s+\\." + baseName + "\\s+import"
                + "|import\\s+[\\w.]*\\b" + baseName + "\\s*;");
        return reexport.matcher(companionContent.get()).find();
    }

    private static String reexportLine(ConstraintContext context) {
        String baseName = baseNameOf(context.fileName());
        if (".py".equals(context.parsedFile().extension())) {
            return "from ." + baseName + " import *";
        }
        return "export * from './" + baseName + "';";
    }

    private static String scaffold(String companionName, ConstraintContext context) {
        String baseName = baseNameOf(context.fileName());
        if (companionName.startsWith("index.") || companionName.equals("__init__.py")) {
            return reexportLine(context);
        }
        if (companionName.contains(".stories.")) {
            return "import type { Meta, StoryObj } from '@storybook/react';\n"
                + "import { " + baseName + " } from './" + baseName + "';\n\n"
                + "const meta: Meta<typeof " + baseName + "> = { component: " + baseName + " };\n"
                + "export default meta;\n"
                + "export const Default: StoryObj<typeof " + baseName + "> = {};\n";
        }
        if (companionName.endsWith("Test.java")) {
            return "class " + baseNameOf(companionName) + " {\n\n    @Test\n    void " + baseName
                + "_behaves() {\n    }\n}\n";
        }
        if (companionName.contains(".test.") || companionName.contains(".spec.")) {
            return "describe('" + baseName + "', () => {\n  it('works', () => {\n  });\n});\n";
        }
        return "";
    }

    // ==================== Value parsing ====================

    private record Companion(String template, boolean mustExport) {}

    private static List<Companion> companionsOf(Object value) {
        List<Companion> companions = new ArrayList<>();
        if (value instanceof String template && !template.isEmpty()) {
            companions.add(new Companion(template, false));
        } else if (value instanceof Map<?, ?> map) {
            Object path = map.get("path");
            if (path != null) {
                Object mustExport = map.containsKey("mustExport") ? map.get("mustExport") : map.get("must_export");
                companions.add(new Companion(String.valueOf(path), Boolean.TRUE.equals(mustExport)
                    || "true".equals(String.valueOf(mustExport))));
            }
        } else if (value instanceof List<?> list) {
            for (Object entry : list) {
                companions.addAll(companionsOf(entry));
            }
        }
        return companions;
    }
}
