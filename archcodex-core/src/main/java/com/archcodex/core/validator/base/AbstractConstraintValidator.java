package com.archcodex.core.validator.base;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ConstraintValidator;
import com.archcodex.core.validator.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Base class for constraint validators providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per validator class)</li>
 *   <li>Violation builders pre-filled with code, rule, severity, why and source</li>
 *   <li>Type name and module specifier matching</li>
 * </ul>
 *
 * @see ConstraintValidator
 * @since 1.0.0
 */
public abstract class AbstractConstraintValidator implements ConstraintValidator {

    private static final Map<String, Pattern> MODULE_GLOB_CACHE = new ConcurrentHashMap<>();

    /**
     * Logger instance for this validator.
     * Automatically initialized with the concrete validator class name.
     */
    protected final Logger log;

    protected AbstractConstraintValidator() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Violation Building ====================

    /**
     * Violation builder carrying everything the constraint decides: code, rule, severity, value,
     * why, source and alternatives.
     *
     * @param constraint constraint being evaluated
     * @param context evaluation scope
     * @return builder; callers add message, location and remediation
     */
    protected Violation.Builder violation(Constraint constraint, ConstraintContext context) {
        return Violation.builder(getErrorCode(), getRule(), constraint.severity())
            .value(constraint.value())
            .why(constraint.why())
            .source(sourceOf(constraint, context))
            .alternatives(constraint.alternatives());
    }

    protected static String sourceOf(Constraint constraint, ConstraintContext context) {
        return constraint.source().isEmpty() ? context.constraintSource() : constraint.source();
    }

    protected static ValidationOutcome outcome(List<Violation> violations) {
        return ValidationOutcome.of(violations);
    }

    /**
     * Passing outcome carrying an info note, for cross-file rules run without a project context.
     *
     * @param constraint constraint that could not be evaluated
     * @param context evaluation scope
     * @return passing outcome with one info-level violation
     */
    protected ValidationOutcome notEvaluated(Constraint constraint, ConstraintContext context) {
        log.debug("{} not evaluated for {}: no project context", getRule(), context.filePath());
        Violation note = Violation.builder(getErrorCode(), getRule(), Severity.INFO)
            .value(constraint.value())
            .why(constraint.why())
            .source(sourceOf(constraint, context))
            .message(getRule() + " not evaluated: no project context available")
            .build();
        return new ValidationOutcome(true, List.of(note));
    }

    // ==================== Type Names ====================

    /**
     * Removes generic arguments: {@code BaseService<User>} becomes {@code BaseService}.
     *
     * @param type type as written
     * @return raw type name
     */
    protected static String stripGenerics(String type) {
        if (type == null) {
            return null;
        }
        int angle = type.indexOf('<');
        return (angle >= 0 ? type.substring(0, angle) : type).trim();
    }

    /**
     * Compares type names ignoring generics and, when only one side is qualified, the package.
     *
     * @param actual type name found in the source
     * @param required type name from the constraint
     * @return true when both denote the same type
     */
    protected static boolean sameType(String actual, String required) {
        String a = stripGenerics(actual);
        String r = stripGenerics(required);
        if (a == null || r == null) {
            return false;
        }
        if (a.equals(r)) {
            return true;
        }
        boolean aQualified = a.contains(".");
        boolean rQualified = r.contains(".");
        if (aQualified == rQualified) {
            return false;
        }
        return simpleName(a).equals(simpleName(r));
    }

    protected static String simpleName(String type) {
        return type.substring(type.lastIndexOf('.') + 1);
    }

    // ==================== Module Specifiers ====================

    /**
     * Module specifier matching: exact, subpath ({@code lodash} matches {@code lodash/map} and
     * {@code java.util} matches {@code java.util.List}), {@code /regex/} or {@code *}/{@code **} globs.
     *
     * @param specifier imported module
     * @param pattern module pattern from the constraint
     * @return true when the specifier is covered by the pattern
     */
    protected static boolean matchesModule(String specifier, String pattern) {
        if (GlobPatterns.isRegexLiteral(pattern)) {
            return GlobPatterns.matchesDotted(pattern, specifier);
        }
        if (pattern.contains("*")) {
            return MODULE_GLOB_CACHE.computeIfAbsent(pattern, AbstractConstraintValidator::compileModuleGlob)
                .matcher(specifier).matches();
        }
        return specifier.equals(pattern)
            || specifier.startsWith(pattern + "/")
            || specifier.startsWith(pattern + ".");
    }

    private static Pattern compileModuleGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/.]*");
                i++;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    // ==================== Files ====================

    /**
     * Whether the file under validation is a test file according to the configured globs.
     *
     * @param context evaluation scope
     * @return true for test files
     */
    protected static boolean isTestFile(ConstraintContext context) {
        return context.testFilePatterns().stream().anyMatch(glob -> GlobPatterns.matchesPath(glob, context.filePath()));
    }

    /**
     * Existence check through the project context when present, the file system otherwise.
     *
     * @param context evaluation scope
     * @param path path to check
     * @return true when the file exists
     */
    protected static boolean fileExists(ConstraintContext context, String path) {
        if (context.project() != null) {
            return context.project().exists(path);
        }
        return Files.isRegularFile(Path.of(path));
    }

    /**
     * Reads a file through the project context when present, the file system otherwise.
     *
     * @param context evaluation scope
     * @param path path to read
     * @return content, empty when the file does not exist
     * @throws UncheckedIOException when the file exists but cannot be read
     */
    protected static Optional<String> readFile(ConstraintContext context, String path) {
        if (context.project() != null) {
            return context.project().read(path);
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    protected static String directoryOf(String filePath) {
        String normalized = filePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(0, slash) : "";
    }

    /**
     * File name without its last extension: {@code PaymentService.ts} becomes {@code PaymentService}.
     *
     * @param fileName file name
     * @return base name
     */
    protected static String baseNameOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    protected static String joinPath(String directory, String relative) {
        if (relative.startsWith("/") || directory.isEmpty()) {
            return relative;
        }
        return Path.of(directory).resolve(relative).normalize().toString().replace('\\', '/');
    }

    protected static String quoteAll(List<String> values) {
        return String.join(", ", values.stream().map(v -> "'" + v + "'").toList());
    }
}
