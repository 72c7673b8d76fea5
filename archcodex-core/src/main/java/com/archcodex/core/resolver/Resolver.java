package com.archcodex.core.resolver;

import com.archcodex.core.exception.ArchitectureNotFoundException;
import com.archcodex.core.exception.CircularInheritanceException;
import com.archcodex.core.exception.MixinNotFoundException;
import com.archcodex.core.model.ArchitectureNode;
import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.FlattenedArchitecture;
import com.archcodex.core.model.Hint;
import com.archcodex.core.model.InlineMode;
import com.archcodex.core.model.Mixin;
import com.archcodex.core.model.Pointer;
import com.archcodex.core.model.Registry;
import com.archcodex.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattens an architecture's inheritance chain and mixins into one effective constraint set.
 *
 * <p>Resolution walks {@code inherits} edges from the requested id to the root, then applies
 * nodes root to leaf. At each node the node's mixins are applied in declaration order, then the
 * node's own constraints, then the node's {@code exclude_constraints}. Inline mixins from a
 * {@code @arch id +mixin} tag are appended to the leaf's mixin list for that call only.
 *
 * <p>Every dropped, replaced or contradictory constraint is reported in
 * {@link ResolutionResult#conflicts()}; nothing is discarded silently. Conditional clauses
 * ({@code when}, {@code unless}, {@code applies_when}) are carried through unevaluated.
 *
 * <p>Resolution is pure: for a fixed registry, repeated calls return equal results.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ResolutionResult result = Resolver.resolveArchitecture(registry, "svc.payment", List.of("tested"));
 * for (Constraint c : result.architecture().constraints()) {
 *     // c.source() is the architecture or "mixin:<id>" that contributed it
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Resolver {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    /** Safety bound on inheritance depth */
    public static final int MAX_INHERITANCE_DEPTH = 10;

    /** Conflict rule used when a mixin marked forbidden for inline use is applied inline */
    public static final String MIXIN_INLINE_FORBIDDEN = "mixin_inline_forbidden";

    /** Conflict rule used when an inline-only mixin is listed in a registry definition */
    public static final String MIXIN_INLINE_ONLY = "mixin_inline_only";

    /** Conflict rule used when two applied mixins contradict each other */
    public static final String MIXIN_CONFLICT = "mixin_conflict";

    private Resolver() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Resolves an architecture without use-site mixins.
     *
     * @param registry registry to resolve against
     * @param archId architecture to resolve
     * @return flattened architecture and conflicts
     * @throws ArchitectureNotFoundException if {@code archId} or a parent is unknown
     * @throws CircularInheritanceException if the chain loops or exceeds {@link #MAX_INHERITANCE_DEPTH}
     * @throws MixinNotFoundException if a referenced mixin is unknown
     */
    public static ResolutionResult resolveArchitecture(Registry registry, String archId) {
        return resolveArchitecture(registry, archId, List.of());
    }

    /**
     * Resolves an architecture, appending use-site mixins to the leaf.
     *
     * @param registry registry to resolve against
     * @param archId architecture to resolve
     * @param inlineMixins mixin ids from the file's {@code @arch} tag, may be empty
     * @return flattened architecture and conflicts
     * @throws ArchitectureNotFoundException if {@code archId} or a parent is unknown
     * @throws CircularInheritanceException if the chain loops or exceeds {@link #MAX_INHERITANCE_DEPTH}
     * @throws MixinNotFoundException if a referenced mixin is unknown
     */
    public static ResolutionResult resolveArchitecture(Registry registry, String archId, List<String> inlineMixins) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(archId, "archId must not be null");
        List<String> inline = inlineMixins != null ? inlineMixins : List.of();

        List<String> chain = new ArrayList<>(buildInheritanceChain(registry, archId));
        Collections.reverse(chain);
        log.debug("Resolving '{}' with chain {} and inline mixins {}", archId, chain, inline);

        List<ConflictReport> conflicts = new ArrayList<>();
        ConstraintAccumulator accumulator = new ConstraintAccumulator(conflicts);
        Set<String> appliedMixins = new LinkedHashSet<>();
        Map<String, Hint> hints = new LinkedHashMap<>();
        Map<String, Pointer> pointers = new LinkedHashMap<>();

        for (int level = 0; level < chain.size(); level++) {
            String nodeId = chain.get(level);
            ArchitectureNode node = registry.findArchitecture(nodeId)
                .orElseThrow(() -> new ArchitectureNotFoundException(nodeId));
            boolean leaf = level == chain.size() - 1;

            for (String mixinId : node.mixins()) {
                Mixin mixin = registry.findMixin(mixinId)
                    .orElseThrow(() -> new MixinNotFoundException(mixinId, nodeId));
                if (mixin.inline() == InlineMode.ONLY) {
                    conflicts.add(new ConflictReport(MIXIN_INLINE_ONLY, mixinId, nodeId, mixin.sourceTag(), null,
                        "Mixin '" + mixinId + "' is inline-only but is listed in the definition of '" + nodeId + "'",
                        Severity.WARNING));
                }
                applyMixin(mixin, level, accumulator, appliedMixins, hints, pointers);
            }
            if (leaf) {
                for (String mixinId : inline) {
                    Mixin mixin = registry.findMixin(mixinId)
                        .orElseThrow(() -> new MixinNotFoundException(mixinId, archId));
                    if (mixin.inline() == InlineMode.FORBIDDEN) {
                        conflicts.add(new ConflictReport(MIXIN_INLINE_FORBIDDEN, mixinId, archId, mixin.sourceTag(),
                            null,
                            "Mixin '" + mixinId + "' must not be applied inline; add it to the definition of '"
                                + archId + "' instead",
                            Severity.WARNING));
                    }
                    applyMixin(mixin, level, accumulator, appliedMixins, hints, pointers);
                }
            }

            for (Constraint constraint : node.constraints()) {
                accumulator.add(constraint.withSource(nodeId), level, false);
            }
            for (String pattern : node.excludeConstraints()) {
                accumulator.exclude(pattern, nodeId);
            }
            node.hints().forEach(h -> hints.putIfAbsent(h.text(), h));
            node.pointers().forEach(p -> pointers.putIfAbsent(p.uri(), p));
        }

        new MixinConflictDetector(conflicts).detect(appliedMixins.stream()
            .flatMap(id -> registry.findMixin(id).stream())
            .toList());
        List<Constraint> constraints = new ConstraintReconciler(conflicts).reconcile(accumulator.constraints());
        ArchitectureNode leafNode = registry.findArchitecture(archId)
            .orElseThrow(() -> new ArchitectureNotFoundException(archId));

        FlattenedArchitecture architecture = new FlattenedArchitecture(
            archId,
            chain,
            List.copyOf(appliedMixins),
            constraints,
            List.copyOf(hints.values()),
            List.copyOf(pointers.values()),
            leafNode.description(),
            leafNode.rationale(),
            leafNode.kind(),
            leafNode.version(),
            leafNode.deprecatedFrom(),
            leafNode.migrationGuide(),
            leafNode.referenceImplementations(),
            leafNode.filePattern(),
            leafNode.defaultPath(),
            leafNode.singleton(),
            leafNode.expectedIntents(),
            leafNode.suggestedIntents()
        );

        if (!conflicts.isEmpty()) {
            log.debug("Resolved '{}' with {} constraint(s) and {} conflict(s)", archId, constraints.size(),
                conflicts.size());
        }
        return new ResolutionResult(architecture, conflicts);
    }

    /**
     * Walks {@code inherits} edges from {@code archId} to the root.
     *
     * @param registry registry to read
     * @param archId starting architecture
     * @return ids from leaf to root
     * @throws ArchitectureNotFoundException if an id on the chain is unknown
     * @throws CircularInheritanceException if an id repeats or the depth bound is exceeded
     */
    public static List<String> buildInheritanceChain(Registry registry, String archId) {
        List<String> chain = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        String current = archId;
        while (current != null) {
            if (!visited.add(current)) {
                List<String> path = new ArrayList<>(chain);
                path.add(current);
                throw new CircularInheritanceException(archId, path);
            }
            chain.add(current);
            if (chain.size() > MAX_INHERITANCE_DEPTH) {
                throw new CircularInheritanceException(archId, chain, MAX_INHERITANCE_DEPTH);
            }
            String nodeId = current;
            ArchitectureNode node = registry.findArchitecture(nodeId)
                .orElseThrow(() -> new ArchitectureNotFoundException(nodeId));
            current = node.inherits();
        }
        return List.copyOf(chain);
    }

    /**
     * Ancestors of an architecture, nearest parent first, excluding the architecture itself.
     *
     * @param registry registry to read
     * @param archId architecture id
     * @return ancestor ids
     */
    public static List<String> getAncestors(Registry registry, String archId) {
        List<String> chain = buildInheritanceChain(registry, archId);
        return chain.subList(1, chain.size());
    }

    /**
     * Effective constraints of an architecture.
     *
     * @param registry registry to read
     * @param archId architecture id
     * @return resolved constraints
     */
    public static List<Constraint> getConstraints(Registry registry, String archId) {
        return resolveArchitecture(registry, archId).architecture().constraints();
    }

    /**
     * Effective hints of an architecture, deduplicated by text.
     *
     * @param registry registry to read
     * @param archId architecture id
     * @return resolved hints
     */
    public static List<Hint> getHints(Registry registry, String archId) {
        return resolveArchitecture(registry, archId).architecture().hints();
    }

    /**
     * Effective pointers of an architecture, deduplicated by uri.
     *
     * @param registry registry to read
     * @param archId architecture id
     * @return resolved pointers
     */
    public static List<Pointer> getPointers(Registry registry, String archId) {
        return resolveArchitecture(registry, archId).architecture().pointers();
    }

    private static void applyMixin(Mixin mixin, int level, ConstraintAccumulator accumulator,
                                   Set<String> appliedMixins, Map<String, Hint> hints, Map<String, Pointer> pointers) {
        if (!appliedMixins.add(mixin.mixinId())) {
            log.debug("Mixin '{}' already applied, skipping repeat", mixin.mixinId());
            return;
        }
        for (Constraint constraint : mixin.constraints()) {
            accumulator.add(constraint.withSource(mixin.sourceTag()), level, true);
        }
        mixin.hints().forEach(h -> hints.putIfAbsent(h.text(), h));
        mixin.pointers().forEach(p -> pointers.putIfAbsent(p.uri(), p));
    }
}
