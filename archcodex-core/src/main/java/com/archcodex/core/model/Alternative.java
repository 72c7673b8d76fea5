package com.archcodex.core.model;

/**
 * Approved replacement offered when a forbidden import or call is found.
 *
 * @param module module or package to use instead
 * @param export specific export of that module, may be null
 * @param description short description, may be null
 * @param example usage example, may be null
 */
public record Alternative(
    String module,
    String export,
    String description,
    String example
) {
    public static Alternative of(String module) {
        return new Alternative(module, null, null, null);
    }
}
