package com.archcodex.core.validator.base;

import com.archcodex.core.model.Alternative;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.DidYouMean;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.support.IntentResolver;

import java.util.List;

/**
 * Base class for deny-list rules ({@code forbid_import}, {@code forbid_call}, ...).
 *
 * <p>Adds the remediation every forbid rule offers: a replace-or-remove {@link Suggestion}, a
 * {@link DidYouMean} pointing at the approved alternative, and intent exemptions listed in
 * {@code unless} as {@code @intent:name}.
 *
 * @since 1.0.0
 */
public abstract class AbstractForbidValidator extends AbstractConstraintValidator {

    static final String DEFAULT_ALTERNATIVE_DESCRIPTION = "Use the approved alternative instead";
    static final String DEFAULT_CANONICAL_DESCRIPTION = "Use the canonical implementation";

    /**
     * Replace suggestion when an alternative exists, remove suggestion otherwise.
     *
     * <p>A plain {@code alternative} wins over detailed {@code alternatives}.
     *
     * @param constraint constraint carrying the alternatives
     * @param target the forbidden text, may be null
     * @return suggestion, never null
     */
    protected Suggestion buildSuggestion(Constraint constraint, String target) {
        if (constraint.alternative() != null) {
            return Suggestion.replace(target, constraint.alternative());
        }
        if (!constraint.alternatives().isEmpty()) {
            Alternative first = constraint.alternatives().get(0);
            String replacement = first.export() != null ? first.export() : first.module();
            return new Suggestion(Suggestion.Action.REPLACE, target, replacement, importStatementFor(first));
        }
        return Suggestion.remove(target);
    }

    /**
     * Import statement for an alternative: a named import when it names an export, a wildcard otherwise.
     *
     * @param alternative approved alternative
     * @return import statement
     */
    protected String importStatementFor(Alternative alternative) {
        if (alternative.export() == null) {
            return "import * from '" + alternative.module() + "';";
        }
        return "import { " + alternative.export() + " } from '" + alternative.module() + "';";
    }

    protected DidYouMean buildDidYouMean(Constraint constraint) {
        if (constraint.alternative() != null) {
            String description = constraint.why() != null ? constraint.why() : DEFAULT_ALTERNATIVE_DESCRIPTION;
            return new DidYouMean(constraint.alternative(), null, description, null);
        }
        if (!constraint.alternatives().isEmpty()) {
            Alternative first = constraint.alternatives().get(0);
            String description = first.description() != null ? first.description() : DEFAULT_CANONICAL_DESCRIPTION;
            return new DidYouMean(first.module(), first.export(), description, first.example());
        }
        return null;
    }

    /**
     * Whether an {@code @intent:x} exemption covers the given line.
     *
     * <p>Function-level intents are checked first; file-level intents apply when the enclosing
     * function declares none.
     *
     * @param constraint constraint with {@code unless} entries
     * @param context evaluation scope
     * @param line 1-based line of the finding
     * @return true when the finding is exempt
     */
    protected boolean isExemptByIntent(Constraint constraint, ConstraintContext context, int line) {
        List<String> exemptions = IntentResolver.exemptionsIn(constraint.unless());
        if (exemptions.isEmpty()) {
            return false;
        }
        List<String> active = IntentResolver.intentsAt(context, line);
        return exemptions.stream().anyMatch(active::contains);
    }
}
