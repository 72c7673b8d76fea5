package com.archcodex.core.validator.impl.intent;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.IntentDefinition;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.tag.IntentAnnotation;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;
import com.archcodex.core.validator.support.ContentPatterns;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * {@code verify_intent}: every declared intent holds against the file.
 *
 * <p>For each intent found in the file (header or function doc comments) that the intent registry
 * defines:
 * <ul>
 *   <li>I002: a {@code requires} pattern is missing, or a {@code forbids} pattern is present</li>
 *   <li>I003: an intent listed in {@code conflictsWith} is also declared (reported once per pair)</li>
 *   <li>I004: an intent listed in {@code requiresIntent} is not declared</li>
 * </ul>
 *
 * <p>Undefined intents are skipped here; the orchestrator reports them separately.
 *
 * @since 1.0.0
 */
public class VerifyIntentValidator extends AbstractConstraintValidator {

    static final String PATTERN_CODE = "I002";
    static final String CONFLICT_CODE = "I003";
    static final String MISSING_INTENT_CODE = "I004";

    @Override
    public String getRule() {
        return "verify_intent";
    }

    @Override
    public String getErrorCode() {
        return PATTERN_CODE;
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Map<String, Integer> declared = declaredIntents(context);
        if (declared.isEmpty() || context.intentRegistry().isEmpty()) {
            return ValidationOutcome.pass();
        }

        String content = context.content();
        List<Violation> violations = new ArrayList<>();
        Set<String> reportedConflicts = new HashSet<>();

        for (Map.Entry<String, Integer> entry : declared.entrySet()) {
            Optional<IntentDefinition> found = context.intentRegistry().find(entry.getKey());
            if (found.isEmpty()) {
                continue;
            }
            IntentDefinition definition = found.get();
            int line = entry.getValue();

            for (String required : definition.requires()) {
                if (!matches(required, content, context)) {
                    violations.add(intentViolation(PATTERN_CODE, constraint, context, line)
                        .message("Intent '@intent:" + definition.name() + "' requires pattern '" + required + "'")
                        .fixHint("Add code matching '" + required + "' or remove '@intent:" + definition.name() + "'")
                        .build());
                }
            }
            for (String forbidden : definition.forbids()) {
                if (matches(forbidden, content, context)) {
                    violations.add(intentViolation(PATTERN_CODE, constraint, context, line)
                        .message("Intent '@intent:" + definition.name() + "' forbids pattern '" + forbidden + "'")
                        .fixHint("Remove code matching '" + forbidden + "' or remove '@intent:" + definition.name() + "'")
                        .build());
                }
            }
            for (String conflict : definition.conflictsWith()) {
                String other = conflict.toLowerCase(Locale.ROOT);
                if (!declared.containsKey(other)) {
                    continue;
                }
                String pair = definition.name().compareTo(other) < 0
                    ? definition.name() + "|" + other : other + "|" + definition.name();
                if (reportedConflicts.add(pair)) {
                    violations.add(intentViolation(CONFLICT_CODE, constraint, context, line)
                        .message("Intent '@intent:" + definition.name() + "' conflicts with '@intent:" + other + "'")
                        .fixHint("Keep only one of '@intent:" + definition.name() + "' and '@intent:" + other + "'")
                        .build());
                }
            }
            for (String requiredIntent : definition.requiresIntent()) {
                String name = requiredIntent.toLowerCase(Locale.ROOT);
                if (!declared.containsKey(name)) {
                    violations.add(intentViolation(MISSING_INTENT_CODE, constraint, context, line)
                        .message("Intent '@intent:" + definition.name() + "' requires '@intent:" + name + "'")
                        .fixHint("Add '@intent:" + name + "' alongside '@intent:" + definition.name() + "'")
                        .build());
                }
            }
        }
        return outcome(violations);
    }

    private Violation.Builder intentViolation(String code, Constraint constraint, ConstraintContext context, int line) {
        Severity severity = constraint.severity();
        return Violation.builder(code, getRule(), severity)
            .value(constraint.value())
            .why(constraint.why())
            .source(sourceOf(constraint, context))
            .line(line)
            .column(1);
    }

    private boolean matches(String pattern, String content, ConstraintContext context) {
        try {
            return ContentPatterns.literalOrRegex(pattern).matcher(content).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid intent pattern '{}' checked in {}: {}", pattern, context.filePath(), e.getDescription());
            return false;
        }
    }

    /**
     * Declared intents with the line of their first declaration, header intents first.
     */
    private static Map<String, Integer> declaredIntents(ConstraintContext context) {
        Map<String, Integer> declared = new LinkedHashMap<>();
        for (IntentAnnotation intent : context.intents()) {
            declared.putIfAbsent(intent.name().toLowerCase(Locale.ROOT), intent.line());
        }
        for (FunctionInfo function : context.parsedFile().functions()) {
            for (String intent : function.intents()) {
                declared.putIfAbsent(intent.toLowerCase(Locale.ROOT), Math.max(1, function.startLine()));
            }
        }
        return declared;
    }
}
