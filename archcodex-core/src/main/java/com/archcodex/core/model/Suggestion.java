package com.archcodex.core.model;

import java.util.Objects;

/**
 * Machine-applicable remediation attached to a violation.
 *
 * @param action what to do
 * @param target the offending text (import, call, pattern)
 * @param replacement replacement text, may be null for removals
 * @param importStatement import to add alongside the replacement, may be null
 */
public record Suggestion(
    Action action,
    String target,
    String replacement,
    String importStatement
) {
    public Suggestion {
        Objects.requireNonNull(action, "action must not be null");
    }

    /**
     * Remediation kinds.
     */
    public enum Action {
        ADD,
        REMOVE,
        REPLACE,
        RENAME
    }

    public static Suggestion replace(String target, String replacement) {
        return new Suggestion(Action.REPLACE, target, replacement, null);
    }

    public static Suggestion remove(String target) {
        return new Suggestion(Action.REMOVE, target, null, null);
    }

    public static Suggestion add(String replacement) {
        return new Suggestion(Action.ADD, null, replacement, null);
    }
}
