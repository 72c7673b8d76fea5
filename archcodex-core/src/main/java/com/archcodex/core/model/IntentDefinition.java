package com.archcodex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Definition of a semantic intent such as {@code stateless} or {@code admin-only}.
 *
 * @param name lowercase intent name
 * @param description what the intent promises
 * @param requires patterns the file content must match when the intent is declared
 * @param forbids patterns the file content must not match when the intent is declared
 * @param conflictsWith intents that cannot be declared alongside this one
 * @param requiresIntent intents that must be declared alongside this one
 * @param category grouping label
 */
public record IntentDefinition(
    String name,
    String description,
    List<String> requires,
    List<String> forbids,
    List<String> conflictsWith,
    List<String> requiresIntent,
    String category
) {
    public IntentDefinition {
        Objects.requireNonNull(name, "name must not be null");
        requires = requires != null ? List.copyOf(requires) : List.of();
        forbids = forbids != null ? List.copyOf(forbids) : List.of();
        conflictsWith = conflictsWith != null ? List.copyOf(conflictsWith) : List.of();
        requiresIntent = requiresIntent != null ? List.copyOf(requiresIntent) : List.of();
    }

    public static IntentDefinition of(String name, String description) {
        return new IntentDefinition(name, description, null, null, null, null, null);
    }
}
