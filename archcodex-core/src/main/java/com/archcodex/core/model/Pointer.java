package com.archcodex.core.model;

import java.util.Objects;

/**
 * Reference to documentation or code ({@code arch://}, {@code code://}, {@code template://}).
 *
 * @param uri target uri, used as the deduplication key
 * @param label display label
 */
public record Pointer(String uri, String label) {

    public Pointer {
        Objects.requireNonNull(uri, "uri must not be null");
    }
}
