package com.archcodex.core.model;

/**
 * Governs whether a mixin may be applied at use-site through an {@code @arch id +mixin} tag.
 */
public enum InlineMode {
    /** Usable both in registry definitions and inline */
    ALLOWED,
    /** Only meant to be applied inline */
    ONLY,
    /** Must not be applied inline */
    FORBIDDEN
}
