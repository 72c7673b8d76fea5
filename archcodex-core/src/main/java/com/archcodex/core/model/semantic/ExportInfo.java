package com.archcodex.core.model.semantic;

import java.util.Objects;

/**
 * Exported symbol.
 *
 * @param name exported name
 * @param kind "class", "interface", "function", "variable", ...
 * @param isDefault default export
 * @param location position
 */
public record ExportInfo(
    String name,
    String kind,
    boolean isDefault,
    SourceLocation location
) {
    public ExportInfo {
        Objects.requireNonNull(name, "name must not be null");
        location = location != null ? location : SourceLocation.START;
    }
}
