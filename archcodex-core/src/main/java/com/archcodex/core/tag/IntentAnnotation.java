package com.archcodex.core.tag;

/**
 * A file-level {@code @intent:name} annotation.
 *
 * @param name lowercase intent name
 * @param line 1-based line
 * @param column 1-based column
 */
public record IntentAnnotation(String name, int line, int column) {}
