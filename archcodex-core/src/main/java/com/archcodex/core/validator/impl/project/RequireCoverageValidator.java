package com.archcodex.core.validator.impl.project;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.util.SourcePatterns;
import com.archcodex.core.util.StringSimilarity;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code require_coverage}: every value this file declares has a handler somewhere in the project.
 *
 * <p>The value is a map:
 * <ul>
 *   <li>{@code source_type}: {@code export_names}, {@code string_literals} or {@code file_names}</li>
 *   <li>{@code source_pattern}: name glob, or for string literals the region regex</li>
 *   <li>{@code extract_values}: per-value regex for string literals, default {@code "([^"]+)"}</li>
 *   <li>{@code in_files}: glob selecting source files; other files pass</li>
 *   <li>{@code target_pattern}: handler text, {@code ${value}} is substituted</li>
 *   <li>{@code transform}: {@code kebab}, {@code lower}, {@code upper} or {@code snake}, optional</li>
 *   <li>{@code in_target_files}: glob selecting the files searched for handlers</li>
 * </ul>
 *
 * <p>Only the sources found in the file under validation are checked, so each gap is reported
 * once, on the file declaring the value.
 *
 * @since 1.0.0
 */
public class RequireCoverageValidator extends AbstractConstraintValidator {

    private static final String VALUE_PLACEHOLDER = "${value}";
    private static final String DEFAULT_EXTRACT_VALUES = "\"([^\"]+)\"";

    @Override
    public String getRule() {
        return "require_coverage";
    }

    @Override
    public String getErrorCode() {
        return "E025";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Map<String, Object> config = constraint.valueAsMap();
        String targetPattern = stringOf(config, "target_pattern");
        String targetFiles = stringOf(config, "in_target_files");
        if (targetPattern == null || targetFiles == null || stringOf(config, "source_type") == null) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("require_coverage requires source_type, target_pattern and in_target_files")
                .fixHint("Add the missing fields to the require_coverage constraint")
                .build());
        }
        Optional<ProjectContext> project = context.projectContext();
        if (project.isEmpty()) {
            return notEvaluated(constraint, context);
        }
        ProjectContext projectContext = project.get();
        String self = projectContext.relativize(context.filePath());
        String inFiles = stringOf(config, "in_files");
        if (inFiles != null && !GlobPatterns.matchesPath(inFiles, self)) {
            return ValidationOutcome.pass();
        }

        List<Source> sources;
        try {
            sources = discoverSources(config, context);
        } catch (PatternSyntaxException e) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("Invalid regex pattern in require_coverage: " + e.getDescription())
                .fixHint("Fix source_pattern or extract_values")
                .build());
        }
        if (sources.isEmpty()) {
            return ValidationOutcome.pass();
        }

        List<String> handlerContents = new ArrayList<>();
        for (String target : projectContext.findFiles(targetFiles)) {
            if (!target.equals(self)) {
                projectContext.read(target).ifPresent(handlerContents::add);
            }
        }

        List<Violation> violations = new ArrayList<>();
        for (Source source : sources) {
            String expected = targetPattern.replace(VALUE_PLACEHOLDER, transform(source.value(), stringOf(config, "transform")));
            if (handlerContents.stream().noneMatch(content -> content.contains(expected))) {
                violations.add(violation(constraint, context)
                    .line(source.line())
                    .column(1)
                    .message("'" + source.value() + "' has no handler: expected '" + expected + "' in " + targetFiles)
                    .fixHint("Add a handler matching '" + expected + "' to a file in " + targetFiles)
                    .build());
            }
        }
        return outcome(violations);
    }

    // ==================== Source discovery ====================

    private record Source(String value, int line) {}

    private List<Source> discoverSources(Map<String, Object> config, ConstraintContext context) {
        String sourcePattern = stringOf(config, "source_pattern");
        String content = context.content();
        List<Source> sources = new ArrayList<>();
        switch (stringOf(config, "source_type")) {
            case "export_names" -> {
                for (ExportInfo export : context.parsedFile().exports()) {
                    if (sourcePattern == null || GlobPatterns.matchesDotted(sourcePattern, export.name())) {
                        sources.add(new Source(export.name(), export.location().line()));
                    }
                }
            }
            case "file_names" -> {
                String baseName = baseNameOf(context.fileName());
                if (sourcePattern == null || GlobPatterns.matchesDotted(sourcePattern, baseName)) {
                    sources.add(new Source(baseName, 1));
                }
            }
            case "string_literals" -> {
                if (sourcePattern == null) {
                    break;
                }
                Matcher region = Pattern.compile(sourcePattern, Pattern.MULTILINE | Pattern.DOTALL).matcher(content);
                if (!region.find()) {
                    break;
                }
                int regionStart = region.groupCount() >= 1 && region.group(1) != null ? region.start(1) : region.start();
                String regionText = region.groupCount() >= 1 && region.group(1) != null ? region.group(1) : region.group();
                String extract = Optional.ofNullable(stringOf(config, "extract_values")).orElse(DEFAULT_EXTRACT_VALUES);
                Matcher values = Pattern.compile(extract).matcher(regionText);
                while (values.find()) {
                    boolean captured = values.groupCount() >= 1 && values.group(1) != null;
                    String value = captured ? values.group(1) : values.group();
                    int offset = regionStart + (captured ? values.start(1) : values.start());
                    sources.add(new Source(value, SourcePatterns.lineOf(content, offset)));
                }
            }
            default -> log.warn("Unsupported require_coverage source_type '{}' in {}",
                stringOf(config, "source_type"), context.filePath());
        }
        return sources;
    }

    private static String transform(String value, String transform) {
        if (transform == null) {
            return value;
        }
        return switch (transform) {
            case "kebab" -> StringSimilarity.toKebabCase(value);
            case "snake" -> StringSimilarity.toKebabCase(value).replace('-', '_');
            case "lower" -> value.toLowerCase(Locale.ROOT);
            case "upper" -> value.toUpperCase(Locale.ROOT);
            default -> value;
        };
    }

    private static String stringOf(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
