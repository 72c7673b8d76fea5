package com.archcodex.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registry definition of one architecture (structural role).
 *
 * <p>Architectures form a tree through {@code inherits}; the resolver walks it root-ward and
 * rejects cycles. Mixins are applied in declaration order before the node's own constraints.
 *
 * @param archId hierarchical dotted id, e.g. {@code svc.payment}
 * @param description short description
 * @param rationale why the role exists
 * @param kind free-form role kind, e.g. "service"
 * @param inherits parent architecture id, may be null
 * @param mixins ordered mixin ids
 * @param constraints direct constraints
 * @param excludeConstraints patterns ({@code rule:value}, {@code rule}, {@code rule:}) removing inherited constraints
 * @param hints guidance
 * @param pointers documentation references
 * @param version definition version
 * @param deprecatedFrom version this architecture was deprecated in
 * @param migrationGuide migration notes for deprecated architectures
 * @param referenceImplementations example files implementing the role
 * @param filePattern suggested file name pattern
 * @param defaultPath suggested directory
 * @param singleton at most one file may carry this architecture
 * @param expectedIntents intents every tagged file should declare
 * @param suggestedIntents intents tagged files commonly declare
 */
public record ArchitectureNode(
    String archId,
    String description,
    String rationale,
    String kind,
    String inherits,
    List<String> mixins,
    List<Constraint> constraints,
    List<String> excludeConstraints,
    List<Hint> hints,
    List<Pointer> pointers,
    String version,
    String deprecatedFrom,
    String migrationGuide,
    List<String> referenceImplementations,
    String filePattern,
    String defaultPath,
    boolean singleton,
    List<String> expectedIntents,
    List<String> suggestedIntents
) {
    /**
     * Compact constructor with validation.
     */
    public ArchitectureNode {
        Objects.requireNonNull(archId, "archId must not be null");
        mixins = mixins != null ? List.copyOf(mixins) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        excludeConstraints = excludeConstraints != null ? List.copyOf(excludeConstraints) : List.of();
        hints = hints != null ? List.copyOf(hints) : List.of();
        pointers = pointers != null ? List.copyOf(pointers) : List.of();
        referenceImplementations = referenceImplementations != null ? List.copyOf(referenceImplementations) : List.of();
        expectedIntents = expectedIntents != null ? List.copyOf(expectedIntents) : List.of();
        suggestedIntents = suggestedIntents != null ? List.copyOf(suggestedIntents) : List.of();
    }

    public static Builder builder(String archId) {
        return new Builder(archId);
    }

    /**
     * Fluent builder; registries are assembled in code since no file format is prescribed.
     */
    public static final class Builder {
        private final String archId;
        private String description;
        private String rationale;
        private String kind;
        private String inherits;
        private final List<String> mixins = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<String> excludeConstraints = new ArrayList<>();
        private final List<Hint> hints = new ArrayList<>();
        private final List<Pointer> pointers = new ArrayList<>();
        private String version;
        private String deprecatedFrom;
        private String migrationGuide;
        private final List<String> referenceImplementations = new ArrayList<>();
        private String filePattern;
        private String defaultPath;
        private boolean singleton;
        private final List<String> expectedIntents = new ArrayList<>();
        private final List<String> suggestedIntents = new ArrayList<>();

        private Builder(String archId) {
            this.archId = archId;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder inherits(String parentId) {
            this.inherits = parentId;
            return this;
        }

        public Builder mixins(String... mixinIds) {
            this.mixins.addAll(List.of(mixinIds));
            return this;
        }

        public Builder constraint(Constraint constraint) {
            this.constraints.add(constraint);
            return this;
        }

        public Builder constraints(List<Constraint> constraints) {
            this.constraints.addAll(constraints);
            return this;
        }

        public Builder excludeConstraints(String... patterns) {
            this.excludeConstraints.addAll(List.of(patterns));
            return this;
        }

        public Builder hint(Hint hint) {
            this.hints.add(hint);
            return this;
        }

        public Builder hint(String text) {
            return hint(Hint.of(text));
        }

        public Builder pointer(Pointer pointer) {
            this.pointers.add(pointer);
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder deprecatedFrom(String deprecatedFrom) {
            this.deprecatedFrom = deprecatedFrom;
            return this;
        }

        public Builder migrationGuide(String migrationGuide) {
            this.migrationGuide = migrationGuide;
            return this;
        }

        public Builder referenceImplementations(String... paths) {
            this.referenceImplementations.addAll(List.of(paths));
            return this;
        }

        public Builder filePattern(String filePattern) {
            this.filePattern = filePattern;
            return this;
        }

        public Builder defaultPath(String defaultPath) {
            this.defaultPath = defaultPath;
            return this;
        }

        public Builder singleton(boolean singleton) {
            this.singleton = singleton;
            return this;
        }

        public Builder expectedIntents(String... intents) {
            this.expectedIntents.addAll(List.of(intents));
            return this;
        }

        public Builder suggestedIntents(String... intents) {
            this.suggestedIntents.addAll(List.of(intents));
            return this;
        }

        public ArchitectureNode build() {
            return new ArchitectureNode(archId, description, rationale, kind, inherits, mixins, constraints,
                excludeConstraints, hints, pointers, version, deprecatedFrom, migrationGuide,
                referenceImplementations, filePattern, defaultPath, singleton, expectedIntents, suggestedIntents);
        }
    }
}
