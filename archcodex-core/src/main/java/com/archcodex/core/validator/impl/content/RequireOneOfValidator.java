package com.archcodex.core.validator.impl.content;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.util.SourcePatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;
import com.archcodex.core.validator.support.ContentPatterns;
import com.archcodex.core.validator.support.IntentResolver;

import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * {@code require_one_of}: at least one of several alternatives is present.
 *
 * <p>Each alternative is dispatched by shape:
 * <ul>
 *   <li>{@code @intent:name}: the file or any of its functions declares the intent</li>
 *   <li>{@code @xxx}: the annotation appears inside a comment (case-insensitive)</li>
 *   <li>{@code /regex/}: multiline, dotAll pattern against the content</li>
 *   <li>anything else: literal substring of the content</li>
 * </ul>
 *
 * <p>The suggested fix prefers an {@code @}-prefixed alternative, the usual opt-out marker.
 * An invalid regex alternative fails the rule even when another alternative matches.
 *
 * @since 1.0.0
 */
public class RequireOneOfValidator extends AbstractConstraintValidator {

    private static final String INTENT_PREFIX = "@intent:";

    @Override
    public String getRule() {
        return "require_one_of";
    }

    @Override
    public String getErrorCode() {
        return "E020";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        List<String> alternatives = constraint.valueAsList();
        if (alternatives.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("require_one_of requires an array of patterns")
                .fixHint("Set the constraint value to a list of alternatives")
                .build());
        }
        for (String alternative : alternatives) {
            if (!isRegex(alternative)) {
                continue;
            }
            try {
                ContentPatterns.multiline(regexOf(alternative));
            } catch (PatternSyntaxException e) {
                return ValidationOutcome.fail(violation(constraint, context)
                    .line(1)
                    .column(1)
                    .message("Invalid regex pattern '" + alternative + "' in require_one_of: " + e.getDescription())
                    .fixHint("Fix the regular expression in the require_one_of constraint")
                    .build());
            }
        }
        for (String alternative : alternatives) {
            if (matches(alternative, context)) {
                return ValidationOutcome.pass();
            }
        }

        String optOut = alternatives.stream().filter(a -> a.startsWith("@")).findFirst().orElse(null);
        String preferred = optOut != null ? optOut : alternatives.get(0);
        String fixHint = optOut != null
            ? "Add one of the required patterns, or add '" + optOut + "' to opt-out"
            : "Add one of the required patterns: " + quoteAll(alternatives);
        return ValidationOutcome.fail(violation(constraint, context)
            .line(1)
            .column(1)
            .message("None of the required patterns found: " + quoteAll(alternatives))
            .fixHint(fixHint)
            .suggestion(Suggestion.add(preferred))
            .build());
    }

    private boolean matches(String alternative, ConstraintContext context) {
        String content = context.content();
        if (alternative.startsWith(INTENT_PREFIX)) {
            String intent = alternative.substring(INTENT_PREFIX.length()).trim().toLowerCase(Locale.ROOT);
            return IntentResolver.allIntents(context).contains(intent);
        }
        if (alternative.startsWith("@")) {
            String needle = alternative.toLowerCase(Locale.ROOT);
            List<SourcePatterns.Comment> comments = ".py".equals(context.parsedFile().extension())
                ? SourcePatterns.hashComments(content)
                : SourcePatterns.cStyleComments(content);
            return comments.stream().anyMatch(c -> c.text().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (isRegex(alternative)) {
            return ContentPatterns.multiline(regexOf(alternative)).matcher(content).find();
        }
        return content.contains(alternative);
    }

    private static boolean isRegex(String alternative) {
        return alternative.length() > 2 && alternative.startsWith("/") && alternative.endsWith("/");
    }

    private static String regexOf(String alternative) {
        return alternative.substring(1, alternative.length() - 1);
    }
}
