package com.archcodex.core.model;

/**
 * Pointer to the canonical implementation a violation should use instead.
 *
 * @param file module or file to use
 * @param export export within it, may be null
 * @param description short description
 * @param exampleUsage example, may be null
 */
public record DidYouMean(
    String file,
    String export,
    String description,
    String exampleUsage
) {}
