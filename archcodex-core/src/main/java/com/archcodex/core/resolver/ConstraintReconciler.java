package com.archcodex.core.resolver;

import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Post-merge pass reconciling rule pairs that contradict each other across slots.
 *
 * <ul>
 *   <li>{@code allow_import} removes the matching values from {@code forbid_import}</li>
 *   <li>{@code allow_pattern} removes the {@code forbid_pattern} with the same pattern</li>
 *   <li>{@code forbid_decorator} beats {@code require_decorator} on the same decorator</li>
 *   <li>{@code require_import} vs {@code forbid_import} on the same module is unresolvable: both stay</li>
 * </ul>
 *
 * <p>Allow rules are consumed by this pass and never reach the validators.
 */
final class ConstraintReconciler {

    private final List<ConflictReport> conflicts;

    ConstraintReconciler(List<ConflictReport> conflicts) {
        this.conflicts = conflicts;
    }

    List<Constraint> reconcile(List<Constraint> input) {
        List<Constraint> constraints = new ArrayList<>(input);
        applyAllowImports(constraints);
        applyAllowPatterns(constraints);
        applyDecoratorDenials(constraints);
        reportRequiredButForbiddenImports(constraints);
        return List.copyOf(constraints);
    }

    private void applyAllowImports(List<Constraint> constraints) {
        List<Constraint> allows = byRule(constraints, "allow_import");
        for (Constraint allow : allows) {
            for (String allowed : allow.valueAsList()) {
                for (int i = 0; i < constraints.size(); i++) {
                    Constraint forbid = constraints.get(i);
                    if (!forbid.rule().equals("forbid_import") || !forbid.valueAsList().contains(allowed)) {
                        continue;
                    }
                    conflicts.add(new ConflictReport("forbid_import", allowed, allow.source(), forbid.source(), forbid,
                        "allow_import from '" + allow.source() + "' permits '" + allowed + "' forbidden by '"
                            + forbid.source() + "'",
                        Severity.WARNING));
                    Optional<Constraint> remaining = withoutValue(forbid, allowed);
                    if (remaining.isPresent()) {
                        constraints.set(i, remaining.get());
                    } else {
                        constraints.remove(i);
                        i--;
                    }
                }
            }
        }
        constraints.removeAll(allows);
    }

    private void applyAllowPatterns(List<Constraint> constraints) {
        List<Constraint> allows = byRule(constraints, "allow_pattern");
        for (Constraint allow : allows) {
            Optional<String> allowed = allow.patternOrValue();
            if (allowed.isEmpty()) {
                continue;
            }
            List<Constraint> removed = constraints.stream()
                .filter(c -> c.rule().equals("forbid_pattern") && c.patternOrValue().equals(allowed))
                .toList();
            for (Constraint forbid : removed) {
                conflicts.add(new ConflictReport("forbid_pattern", allowed.get(), allow.source(), forbid.source(),
                    forbid,
                    "allow_pattern from '" + allow.source() + "' permits pattern forbidden by '" + forbid.source() + "'",
                    Severity.WARNING));
            }
            constraints.removeAll(removed);
        }
        constraints.removeAll(allows);
    }

    private void applyDecoratorDenials(List<Constraint> constraints) {
        for (Constraint forbid : byRule(constraints, "forbid_decorator")) {
            for (String decorator : forbid.valueAsList()) {
                for (int i = 0; i < constraints.size(); i++) {
                    Constraint require = constraints.get(i);
                    if (!require.rule().equals("require_decorator") || !containsDecorator(require, decorator)) {
                        continue;
                    }
                    conflicts.add(new ConflictReport("require_decorator", decorator, forbid.source(), require.source(),
                        require,
                        "forbid_decorator from '" + forbid.source() + "' overrides require_decorator from '"
                            + require.source() + "': deny wins",
                        Severity.WARNING));
                    Optional<Constraint> remaining = withoutValue(require, decorator);
                    if (remaining.isPresent()) {
                        constraints.set(i, remaining.get());
                    } else {
                        constraints.remove(i);
                        i--;
                    }
                }
            }
        }
    }

    private void reportRequiredButForbiddenImports(List<Constraint> constraints) {
        for (Constraint require : byRule(constraints, "require_import")) {
            for (Constraint forbid : byRule(constraints, "forbid_import")) {
                for (String module : require.valueAsList()) {
                    if (forbid.valueAsList().contains(module)) {
                        conflicts.add(new ConflictReport("require_import", module, require.source(), forbid.source(),
                            forbid,
                            "'" + module + "' is required by '" + require.source() + "' but forbidden by '"
                                + forbid.source() + "'",
                            Severity.ERROR));
                    }
                }
            }
        }
    }

    private static boolean containsDecorator(Constraint constraint, String decorator) {
        String bare = stripAt(decorator);
        return constraint.valueAsList().stream().anyMatch(v -> stripAt(v).equals(bare));
    }

    private static String stripAt(String decorator) {
        return decorator.startsWith("@") ? decorator.substring(1) : decorator;
    }

    private static Optional<Constraint> withoutValue(Constraint constraint, String value) {
        String bare = stripAt(value);
        List<String> remaining = constraint.valueAsList().stream()
            .filter(v -> !stripAt(v).equals(bare))
            .toList();
        if (remaining.isEmpty()) {
            return Optional.empty();
        }
        Object newValue = remaining.size() == 1 && !(constraint.value() instanceof List<?>) ? remaining.get(0) : remaining;
        return Optional.of(constraint.toBuilder().value(newValue).build());
    }

    private static List<Constraint> byRule(List<Constraint> constraints, String rule) {
        return constraints.stream().filter(c -> c.rule().equals(rule)).toList();
    }
}
