package com.archcodex.core.resolver;

import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Mixin;
import com.archcodex.core.model.Severity;

import java.util.List;

/**
 * Reports contradictions between two different mixins applied to the same architecture.
 *
 * <p>Runs on the raw mixin declarations, before {@link ConstraintReconciler} rewrites the merged set.
 * Decorator and import contradictions between mixins cannot be settled by precedence, so they are
 * recorded as errors. A mixin {@code allow_import} over another mixin's {@code forbid_import} is
 * only a warning because the allow still wins during reconciliation.
 */
final class MixinConflictDetector {

    private static final String UNRESOLVED = "unresolved";

    private final List<ConflictReport> conflicts;

    MixinConflictDetector(List<ConflictReport> conflicts) {
        this.conflicts = conflicts;
    }

    void detect(List<Mixin> mixins) {
        for (Mixin forbidding : mixins) {
            for (Mixin other : mixins) {
                if (forbidding.mixinId().equals(other.mixinId())) {
                    continue;
                }
                compare(forbidding, other);
            }
        }
    }

    private void compare(Mixin forbidding, Mixin other) {
        for (Constraint forbid : forbidding.constraints()) {
            for (Constraint candidate : other.constraints()) {
                switch (forbid.rule() + "/" + candidate.rule()) {
                    case "forbid_import/allow_import" -> overlapping(forbid, candidate, false).forEach(module ->
                        conflicts.add(new ConflictReport(Resolver.MIXIN_CONFLICT, module, other.sourceTag(),
                            forbidding.sourceTag(), forbid,
                            "Mixins conflict: '" + other.mixinId() + "' allows '" + module + "' but '"
                                + forbidding.mixinId() + "' forbids it",
                            Severity.WARNING)));
                    case "forbid_import/require_import" -> overlapping(forbid, candidate, false).forEach(module ->
                        conflicts.add(new ConflictReport(Resolver.MIXIN_CONFLICT, module, UNRESOLVED, UNRESOLVED,
                            null,
                            "Mixins conflict: '" + other.mixinId() + "' requires '" + module + "' but '"
                                + forbidding.mixinId() + "' forbids it",
                            Severity.ERROR)));
                    case "forbid_decorator/require_decorator" -> overlapping(forbid, candidate, true).forEach(
                        decorator -> conflicts.add(new ConflictReport(Resolver.MIXIN_CONFLICT, decorator, UNRESOLVED,
                            UNRESOLVED, null,
                            "Mixins conflict: '" + other.mixinId() + "' requires decorator '" + decorator + "' but '"
                                + forbidding.mixinId() + "' forbids it",
                            Severity.ERROR)));
                    default -> {
                        // other rule pairs merge by precedence
                    }
                }
            }
        }
    }

    private static List<String> overlapping(Constraint forbid, Constraint candidate, boolean decorators) {
        List<String> forbidden = forbid.valueAsList().stream()
            .map(v -> decorators ? stripAt(v) : v)
            .toList();
        return candidate.valueAsList().stream()
            .filter(v -> forbidden.contains(decorators ? stripAt(v) : v))
            .toList();
    }

    private static String stripAt(String decorator) {
        return decorator.startsWith("@") ? decorator.substring(1) : decorator;
    }
}
