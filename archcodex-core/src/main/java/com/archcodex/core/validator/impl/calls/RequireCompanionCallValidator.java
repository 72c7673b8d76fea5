package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.util.GlobPatterns;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code require_companion_call}: an operation on a target is accompanied by a companion call,
 * e.g. every {@code db.insert("posts", ...)} by {@code invalidateCache()}.
 *
 * <p>The value is either a single rule {@code {target, operations, call, location}} or
 * {@code {rules: [...]}}. {@code location} is {@code same_file} (default), {@code after} or
 * {@code same_function}. The constraint's {@code pattern} limits which callees count as
 * operations.
 *
 * <p>The target of an operation is its first argument, unquoted. With
 * {@code targetDetection: {mode: method_chain, receiver: prisma}} it is the receiver instead
 * ({@code prisma.users.create()} targets {@code users}).
 *
 * @since 1.0.0
 */
public class RequireCompanionCallValidator extends AbstractConstraintValidator {

    private static final String METHOD_CHAIN = "method_chain";

    @Override
    public String getRule() {
        return "require_companion_call";
    }

    @Override
    public String getErrorCode() {
        return "E021";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Map<String, Object> value = constraint.valueAsMap();
        List<CompanionRule> rules = rulesOf(value);
        if (rules.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("require_companion_call requires 'target', 'operations' and 'call', or a 'rules' list")
                .fixHint("Describe the companion call as {target, operations, call}")
                .build());
        }
        TargetDetection detection = TargetDetection.of(value.get("targetDetection"));

        List<FunctionCallInfo> calls = context.parsedFile().functionCalls();
        List<Violation> violations = new ArrayList<>();
        for (FunctionCallInfo call : calls) {
            if (constraint.pattern() != null && !GlobPatterns.matchesDotted(constraint.pattern(), call.callee())) {
                continue;
            }
            String target = detection.targetOf(call);
            for (CompanionRule rule : rules) {
                if (!rule.target().equals(target) || !rule.operations().contains(call.methodName())) {
                    continue;
                }
                if (hasCompanion(rule, call, calls)) {
                    continue;
                }
                violations.add(violation(constraint, context)
                    .line(call.location().line())
                    .column(call.location().column())
                    .message(call.methodName() + "(" + target + ") requires a call to '" + rule.call() + "'"
                        + locationSuffix(rule.location()))
                    .fixHint("Call '" + rule.call() + "' " + locationHint(rule.location()) + " " + call.callee())
                    .build());
            }
        }
        return outcome(violations);
    }

    private static boolean hasCompanion(CompanionRule rule, FunctionCallInfo operation, List<FunctionCallInfo> calls) {
        return calls.stream()
            .filter(c -> GlobPatterns.matchesDotted(rule.call(), c.callee()))
            .anyMatch(c -> switch (rule.location()) {
                case "after" -> c.location().line() > operation.location().line();
                case "same_function" -> Objects.equals(c.parentFunction(), operation.parentFunction());
                default -> true;
            });
    }

    private static String locationSuffix(String location) {
        return switch (location) {
            case "after" -> " after it";
            case "same_function" -> " in the same function";
            default -> " in the same file";
        };
    }

    private static String locationHint(String location) {
        return switch (location) {
            case "same_function" -> "in the same function as";
            default -> "after";
        };
    }

    // ==================== Value parsing ====================

    private record CompanionRule(String target, List<String> operations, String call, String location) {}

    private static List<CompanionRule> rulesOf(Map<String, Object> value) {
        List<CompanionRule> rules = new ArrayList<>();
        if (value.get("rules") instanceof List<?> list) {
            for (Object entry : list) {
                if (entry instanceof Map<?, ?> map) {
                    ruleOf(map, value.get("location")).ifPresent(rules::add);
                }
            }
        } else {
            ruleOf(value, null).ifPresent(rules::add);
        }
        return rules;
    }

    private static Optional<CompanionRule> ruleOf(Map<?, ?> map, Object defaultLocation) {
        Object target = map.get("target");
        Object call = map.get("call");
        if (target == null || call == null) {
            return Optional.empty();
        }
        List<String> operations = new ArrayList<>();
        Object ops = map.get("operations");
        if (ops instanceof List<?> list) {
            list.forEach(o -> operations.add(String.valueOf(o)));
        } else if (ops != null) {
            operations.add(String.valueOf(ops));
        }
        Object location = map.get("location") != null ? map.get("location") : defaultLocation;
        return Optional.of(new CompanionRule(String.valueOf(target), operations, String.valueOf(call),
            location != null ? String.valueOf(location) : "same_file"));
    }

    private record TargetDetection(boolean methodChain, String receiverBase) {

        static TargetDetection of(Object config) {
            if (config instanceof Map<?, ?> map && METHOD_CHAIN.equals(String.valueOf(map.get("mode")))) {
                Object receiver = map.get("receiver");
                return new TargetDetection(true, receiver != null ? String.valueOf(receiver) : null);
            }
            return new TargetDetection(false, null);
        }

        String targetOf(FunctionCallInfo call) {
            if (!methodChain) {
                return call.arguments().isEmpty() ? null : unquote(call.arguments().get(0));
            }
            String receiver = call.receiver();
            if (receiver == null) {
                return null;
            }
            if (receiverBase != null && receiver.startsWith(receiverBase + ".")) {
                return receiver.substring(receiverBase.length() + 1);
            }
            return receiver;
        }

        private static String unquote(String argument) {
            String trimmed = argument.trim();
            if (trimmed.length() >= 2 && "'\"`".indexOf(trimmed.charAt(0)) >= 0
                    && trimmed.charAt(trimmed.length() - 1) == trimmed.charAt(0)) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
            return trimmed;
        }
    }
}
