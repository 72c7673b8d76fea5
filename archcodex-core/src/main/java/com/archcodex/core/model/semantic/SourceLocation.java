package com.archcodex.core.model.semantic;

/**
 * 1-based position in a source file.
 *
 * @param line line number
 * @param column column number
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    public static SourceLocation at(int line) {
        return new SourceLocation(line, 1);
    }
}
