package com.archcodex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Fully resolved view of one architecture after applying its inheritance chain and mixins.
 *
 * <p>Immutable once returned. Every constraint carries its provenance in
 * {@link Constraint#source()}.
 *
 * @param archId resolved architecture id
 * @param inheritanceChain ids from root to leaf
 * @param appliedMixins mixin ids in application order (registry then inline)
 * @param constraints effective, deduplicated constraints in resolution order
 * @param hints hints deduplicated by text
 * @param pointers pointers deduplicated by uri
 * @param description leaf description
 * @param rationale leaf rationale
 * @param kind leaf kind
 * @param version leaf version
 * @param deprecatedFrom deprecation version
 * @param migrationGuide migration notes
 * @param referenceImplementations leaf reference implementations
 * @param filePattern leaf file pattern
 * @param defaultPath leaf default path
 * @param singleton whether the leaf is a singleton
 * @param expectedIntents intents expected on tagged files
 * @param suggestedIntents intents suggested for tagged files
 */
public record FlattenedArchitecture(
    String archId,
    List<String> inheritanceChain,
    List<String> appliedMixins,
    List<Constraint> constraints,
    List<Hint> hints,
    List<Pointer> pointers,
    String description,
    String rationale,
    String kind,
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
    public FlattenedArchitecture {
        Objects.requireNonNull(archId, "archId must not be null");
        inheritanceChain = List.copyOf(Objects.requireNonNull(inheritanceChain, "inheritanceChain must not be null"));
        appliedMixins = appliedMixins != null ? List.copyOf(appliedMixins) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        hints = hints != null ? List.copyOf(hints) : List.of();
        pointers = pointers != null ? List.copyOf(pointers) : List.of();
        referenceImplementations = referenceImplementations != null ? List.copyOf(referenceImplementations) : List.of();
        expectedIntents = expectedIntents != null ? List.copyOf(expectedIntents) : List.of();
        suggestedIntents = suggestedIntents != null ? List.copyOf(suggestedIntents) : List.of();
    }

    /**
     * Constraints of one rule kind, in resolution order.
     *
     * @param rule rule kind
     * @return matching constraints
     */
    public List<Constraint> constraintsFor(String rule) {
        return constraints.stream()
            .filter(c -> c.rule().equals(rule))
            .toList();
    }

    public boolean isDeprecated() {
        return deprecatedFrom != null;
    }
}
