package com.archcodex.core.validation;

import com.archcodex.core.exception.InvalidConstraintException;
import com.archcodex.core.model.ConstraintCondition;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.DecoratorInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.support.ContentPatterns;

import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Evaluates the conditional clauses of a constraint: {@code when}, {@code unless} and
 * {@code applies_when}.
 *
 * <p><b>Conditions ({@code when}):</b></p>
 * <ul>
 *   <li>{@code has_decorator}: a class carries the decorator</li>
 *   <li>{@code has_import}: an import matches by module (glob allowed), named or default import</li>
 *   <li>{@code extends}: a class extends the type, directly or through its chain</li>
 *   <li>{@code file_matches}: the path matches the glob</li>
 *   <li>{@code implements}: a class implements the interface</li>
 *   <li>{@code method_has_decorator}: a method or function carries the decorator</li>
 * </ul>
 * Each has a negated {@code not_} form.
 *
 * <p><b>Exemptions ({@code unless}):</b> {@code @intent:x}, {@code decorator:@X},
 * {@code import:x}, or a bare import specifier.
 *
 * @since 1.0.0
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Whether a {@code when} condition holds.
     *
     * @param condition condition, may be null
     * @param model file model
     * @return true when the condition is absent or satisfied
     */
    public static boolean evaluate(ConstraintCondition condition, SemanticModel model) {
        if (condition == null) {
            return true;
        }
        boolean holds = switch (condition.type()) {
            case HAS_DECORATOR -> model.classes().stream()
                .anyMatch(c -> hasDecorator(c.decorators(), condition.value()));
            case HAS_IMPORT -> hasImport(model, condition.value());
            case EXTENDS -> model.classes().stream().anyMatch(c -> extendsType(c, condition.value()));
            case FILE_MATCHES -> GlobPatterns.matchesPath(condition.value(), model.filePath());
            case IMPLEMENTS -> model.classes().stream()
                .anyMatch(c -> c.implementsInterfaces().contains(condition.value()));
            case METHOD_HAS_DECORATOR -> Stream.concat(
                    model.allMethods().stream().map(m -> m.decorators()),
                    model.functions().stream().map(f -> f.decorators()))
                .anyMatch(decorators -> hasDecorator(decorators, condition.value()));
        };
        return condition.negated() != holds;
    }

    /**
     * Whether an {@code unless} list exempts the file.
     *
     * <p>{@code @intent:x} entries are checked against the file-level intents here; validators that
     * report per line also honour function-level intents.
     *
     * @param unless exemption entries
     * @param context evaluation scope
     * @return true when any entry matches
     */
    public static boolean isExempt(List<String> unless, ConstraintContext context) {
        for (String entry : unless) {
            String trimmed = entry.trim();
            if (trimmed.startsWith("@intent:")) {
                String intent = trimmed.substring("@intent:".length()).toLowerCase(Locale.ROOT);
                if (context.intentNames().contains(intent)) {
                    return true;
                }
            } else if (trimmed.startsWith("decorator:")) {
                String decorator = trimmed.substring("decorator:".length()).trim();
                if (context.parsedFile().allDecoratorNames().contains(stripAt(decorator))) {
                    return true;
                }
            } else if (trimmed.startsWith("import:")) {
                if (hasImport(context.parsedFile(), trimmed.substring("import:".length()).trim())) {
                    return true;
                }
            } else if (!trimmed.isEmpty() && hasImport(context.parsedFile(), trimmed)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether an {@code applies_when} regex matches the content.
     *
     * @param regex multiline, dotAll regex; null applies always
     * @param content file content
     * @return true when absent or matching
     * @throws InvalidConstraintException when the regex does not compile
     */
    public static boolean appliesWhen(String regex, String content) {
        if (regex == null || regex.isEmpty()) {
            return true;
        }
        try {
            return ContentPatterns.multiline(regex).matcher(content).find();
        } catch (PatternSyntaxException e) {
            throw new InvalidConstraintException("Invalid applies_when pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    private static boolean hasImport(SemanticModel model, String pattern) {
        for (ImportInfo importInfo : model.imports()) {
            boolean moduleMatches = pattern.contains("*")
                ? GlobPatterns.matchesPath(pattern, importInfo.moduleSpecifier())
                    || GlobPatterns.matchesDotted(pattern, importInfo.moduleSpecifier())
                : importInfo.moduleSpecifier().equals(pattern);
            if (moduleMatches || importInfo.namedImports().contains(pattern) || pattern.equals(importInfo.defaultImport())) {
                return true;
            }
        }
        return false;
    }

    private static boolean extendsType(ClassInfo classInfo, String type) {
        return type.equals(classInfo.extendsClass()) || classInfo.inheritanceChain().contains(type);
    }

    private static boolean hasDecorator(List<DecoratorInfo> decorators, String name) {
        String bare = stripAt(name);
        return decorators.stream().anyMatch(d -> d.name().equals(bare));
    }

    private static String stripAt(String name) {
        return name.startsWith("@") ? name.substring(1) : name;
    }
}
