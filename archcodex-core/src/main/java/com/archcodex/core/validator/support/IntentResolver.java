package com.archcodex.core.validator.support;

import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.validator.ConstraintContext;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Answers which intents are in force at a given point of a file.
 *
 * <p>Function-level intents take precedence: inside a function that declares intents, only those
 * count. Elsewhere, and inside functions without intents, the file-level intents apply.
 *
 * @since 1.0.0
 */
public final class IntentResolver {

    private IntentResolver() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Intents effective at a line.
     *
     * @param context evaluation scope
     * @param line 1-based line, or 0 for file level
     * @return lowercase intent names
     */
    public static List<String> intentsAt(ConstraintContext context, int line) {
        if (line > 0) {
            FunctionInfo function = context.parsedFile().functionAt(line);
            if (function != null && !function.intents().isEmpty()) {
                return function.intents();
            }
        }
        return context.intentNames();
    }

    public static boolean hasIntentAt(ConstraintContext context, int line, String intent) {
        return intentsAt(context, line).contains(intent.toLowerCase(Locale.ROOT));
    }

    /**
     * Every intent declared anywhere in the file: header plus all functions.
     *
     * @param context evaluation scope
     * @return lowercase intent names in declaration order
     */
    public static Set<String> allIntents(ConstraintContext context) {
        Set<String> intents = new LinkedHashSet<>(context.intentNames());
        for (FunctionInfo function : context.parsedFile().functions()) {
            intents.addAll(function.intents());
        }
        return intents;
    }

    /**
     * Intent names listed as {@code @intent:x} exemptions in an {@code unless} list.
     *
     * @param unless exemption entries
     * @return lowercase intent names
     */
    public static List<String> exemptionsIn(List<String> unless) {
        return unless.stream()
            .filter(entry -> entry.startsWith("@intent:"))
            .map(entry -> entry.substring("@intent:".length()).trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .toList();
    }
}
