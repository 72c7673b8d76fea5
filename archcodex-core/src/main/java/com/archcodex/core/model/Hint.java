package com.archcodex.core.model;

import java.util.Objects;

/**
 * Free-text guidance attached to an architecture or mixin.
 *
 * @param text hint text, used as the deduplication key
 * @param example optional example
 */
public record Hint(String text, String example) {

    public Hint {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static Hint of(String text) {
        return new Hint(text, null);
    }
}
