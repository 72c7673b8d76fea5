package com.archcodex.core.validator.support;

import com.archcodex.core.exception.InvalidConstraintException;
import com.archcodex.core.model.NamingCase;
import com.archcodex.core.model.NamingSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns a structured {@link NamingSpec} into an anchored regular expression.
 *
 * <p>The expression is the literal prefix, the case fragment, the literal suffix and the literal
 * extension, anchored at both ends. A spec without a case uses PascalCase.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * NamingSpec spec = new NamingSpec(NamingCase.PASCAL_CASE, null, "Service", ".ts");
 * NamingPatternCompiler.toRegex(spec);   // ^[A-Z][a-zA-Z0-9]*Service\.ts$
 * NamingPatternCompiler.describe(spec);  // PascalCase, suffix "Service", extension ".ts"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class NamingPatternCompiler {

    public static final String EMPTY_SPEC_MESSAGE =
        "Naming pattern must specify at least one of: case, prefix, suffix, extension";

    private NamingPatternCompiler() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Validation error for a spec.
     *
     * @param spec naming spec, may be null
     * @return error message, empty when the naming spec is usable
     */
    public static Optional<String> validate(NamingSpec spec) {
        return spec == null || spec.isEmpty() ? Optional.of(EMPTY_SPEC_MESSAGE) : Optional.empty();
    }

    /**
     * Regex source for a spec.
     *
     * @param spec naming spec
     * @return anchored regex
     * @throws InvalidConstraintException when the naming spec sets no field
     */
    public static String toRegex(NamingSpec spec) {
        validate(spec).ifPresent(message -> {
            throw new InvalidConstraintException(message);
        });
        NamingCase caseStyle = spec.caseStyle() != null ? spec.caseStyle() : NamingCase.PASCAL_CASE;
        return "^" + escape(spec.prefix()) + caseStyle.fragment() + escape(spec.suffix())
            + escape(spec.extension()) + "$";
    }

    public static Pattern compile(NamingSpec spec) {
        return Pattern.compile(toRegex(spec));
    }

    /**
     * Human-readable description, e.g. {@code prefix "I", PascalCase, suffix "Repository"}.
     *
     * @param spec naming spec
     * @return description listing only the fields that are set
     */
    public static String describe(NamingSpec spec) {
        List<String> parts = new ArrayList<>();
        if (notEmpty(spec.prefix())) {
            parts.add("prefix \"" + spec.prefix() + "\"");
        }
        if (spec.caseStyle() != null) {
            parts.add(spec.caseStyle().label());
        }
        if (notEmpty(spec.suffix())) {
            parts.add("suffix \"" + spec.suffix() + "\"");
        }
        if (notEmpty(spec.extension())) {
            parts.add("extension \"" + spec.extension() + "\"");
        }
        return String.join(", ", parts);
    }

    private static String escape(String literal) {
        if (!notEmpty(literal)) {
            return "";
        }
        StringBuilder escaped = new StringBuilder();
        for (char c : literal.toCharArray()) {
            if ("\\^$.|?*+()[]{}".indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
