package com.archcodex.core.resolver;

import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Slot table used while flattening one architecture.
 *
 * <p>Constraints are keyed by slot: {@code rule:value} for multi-valued rules, and the bare rule for
 * rules that express a single setting per file (limits, naming, base class). A constraint landing
 * on an occupied slot replaces the occupant in place and the occupant is reported as a conflict.
 *
 * <p>Precedence between two sources is decided by application order (leaf-closer wins), except
 * for two mixins applied at the same chain level: numeric limits keep the stricter value, any other
 * slot keeps the later declaration. Both cases are reported as warnings.
 */
final class ConstraintAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintAccumulator.class);

    /** Rules whose slot is the rule itself, not the rule/value pair */
    static final Set<String> SINGLE_SLOT_RULES = Set.of(
        "max_file_lines",
        "max_public_methods",
        "max_similarity",
        "must_extend",
        "naming_pattern",
        "location_pattern"
    );

    /** Rules where a lower numeric value is stricter */
    static final Set<String> LIMIT_RULES = Set.of("max_file_lines", "max_public_methods");

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final List<ConflictReport> conflicts;

    ConstraintAccumulator(List<ConflictReport> conflicts) {
        this.conflicts = conflicts;
    }

    private record Entry(Constraint constraint, int level, boolean fromMixin) {}

    static String slotKeyOf(Constraint constraint) {
        return SINGLE_SLOT_RULES.contains(constraint.rule()) ? constraint.rule() : constraint.slotKey();
    }

    /**
     * Adds a constraint that already carries its provenance.
     *
     * @param constraint constraint with source set
     * @param level position of the contributing node in the root-to-leaf chain
     * @param fromMixin whether a mixin contributed the constraint
     */
    void add(Constraint constraint, int level, boolean fromMixin) {
        if (constraint.override()) {
            dropRule(constraint);
        }

        String key = slotKeyOf(constraint);
        Entry existing = entries.get(key);
        Entry incoming = new Entry(constraint, level, fromMixin);
        if (existing == null) {
            entries.put(key, incoming);
            return;
        }

        Constraint previous = existing.constraint();
        if (previous.source().equals(constraint.source())) {
            log.debug("Duplicate '{}' declaration in '{}', keeping the later one", key, constraint.source());
            entries.put(key, incoming);
            return;
        }

        boolean siblings = existing.fromMixin() && fromMixin && existing.level() == level;
        if (siblings && LIMIT_RULES.contains(constraint.rule())) {
            keepStricter(key, existing, incoming);
        } else if (siblings) {
            entries.put(key, incoming);
            conflicts.add(new ConflictReport(constraint.rule(), previous.valueAsString(), constraint.source(),
                previous.source(), previous,
                "'" + constraint.source() + "' overrides '" + previous.source() + "': later mixin declaration wins",
                Severity.WARNING));
        } else {
            entries.put(key, incoming);
            conflicts.add(new ConflictReport(constraint.rule(), previous.valueAsString(), constraint.source(),
                previous.source(), previous,
                "'" + constraint.source() + "' overrides '" + previous.source() + "' due to precedence",
                Severity.INFO));
        }
    }

    private void keepStricter(String key, Entry existing, Entry incoming) {
        Constraint previous = existing.constraint();
        Constraint candidate = incoming.constraint();
        Optional<Integer> previousLimit = previous.valueAsInt();
        Optional<Integer> candidateLimit = candidate.valueAsInt();
        if (previousLimit.isEmpty() || candidateLimit.isEmpty()) {
            entries.put(key, incoming);
            conflicts.add(new ConflictReport(candidate.rule(), previous.valueAsString(), candidate.source(),
                previous.source(), previous,
                "'" + candidate.source() + "' overrides '" + previous.source() + "': later mixin declaration wins",
                Severity.WARNING));
            return;
        }

        boolean previousStricter = previousLimit.get() <= candidateLimit.get();
        Constraint winner = previousStricter ? previous : candidate;
        Constraint loser = previousStricter ? candidate : previous;
        if (!previousStricter) {
            entries.put(key, incoming);
        }
        conflicts.add(new ConflictReport(candidate.rule(), loser.valueAsString(), winner.source(), loser.source(),
            loser,
            "'" + winner.source() + "' sets " + winner.valueAsString() + ", '" + loser.source() + "' sets "
                + loser.valueAsString() + "; stricter wins",
            Severity.WARNING));
    }

    private void dropRule(Constraint replacement) {
        Iterator<Entry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            Constraint previous = iterator.next().constraint();
            if (previous.rule().equals(replacement.rule())) {
                iterator.remove();
                conflicts.add(new ConflictReport(previous.rule(), previous.valueAsString(), replacement.source(),
                    previous.source(), previous,
                    "'" + replacement.source() + "' overrides every '" + previous.rule() + "' constraint",
                    Severity.INFO));
            }
        }
    }

    /**
     * Applies one {@code exclude_constraints} pattern declared by {@code nodeId}.
     *
     * <p>Accepted forms: {@code rule:value} (one value), {@code rule} and {@code rule:} (whole rule).
     * The node's own constraints are never excluded.
     *
     * @param pattern exclusion pattern
     * @param nodeId declaring architecture
     */
    void exclude(String pattern, String nodeId) {
        int colon = pattern.indexOf(':');
        String rule = colon >= 0 ? pattern.substring(0, colon) : pattern;
        String value = colon >= 0 ? pattern.substring(colon + 1) : "";

        boolean matched = false;
        Map<String, Entry> replacements = new LinkedHashMap<>();
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Entry> slot = iterator.next();
            Constraint candidate = slot.getValue().constraint();
            if (!candidate.rule().equals(rule) || candidate.source().equals(nodeId)) {
                continue;
            }
            if (value.isEmpty() || candidate.valueAsString().equals(value)) {
                iterator.remove();
            } else if (candidate.valueAsList().size() > 1 && candidate.valueAsList().contains(value)) {
                List<String> remaining = new ArrayList<>(candidate.valueAsList());
                remaining.remove(value);
                replacements.put(slot.getKey(), new Entry(candidate.toBuilder().value(remaining).build(),
                    slot.getValue().level(), slot.getValue().fromMixin()));
            } else {
                continue;
            }
            matched = true;
            conflicts.add(new ConflictReport(candidate.rule(), value.isEmpty() ? candidate.valueAsString() : value,
                nodeId, candidate.source(), candidate,
                "'" + nodeId + "' excludes '" + pattern + "' inherited from '" + candidate.source() + "'",
                Severity.INFO));
        }
        entries.putAll(replacements);

        if (!matched) {
            conflicts.add(new ConflictReport("exclude_constraints", pattern, nodeId, nodeId, null,
                "exclude_constraints pattern '" + pattern + "' doesn't match any inherited constraint",
                Severity.WARNING));
        }
    }

    List<Constraint> constraints() {
        return entries.values().stream().map(Entry::constraint).toList();
    }
}
