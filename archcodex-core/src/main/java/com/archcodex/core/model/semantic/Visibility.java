package com.archcodex.core.model.semantic;

/**
 * Member visibility, normalised across languages.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE,
    /** Package-private (Java) or module-internal visibility */
    INTERNAL
}
