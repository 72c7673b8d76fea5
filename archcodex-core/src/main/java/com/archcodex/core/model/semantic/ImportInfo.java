package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * One import statement.
 *
 * @param moduleSpecifier imported module, package or fully-qualified type
 * @param namedImports individually imported names
 * @param defaultImport default/aliased import name, may be null
 * @param typeOnly import used for types only
 * @param dynamic runtime import ({@code import()}, {@code importlib})
 * @param location position of the statement
 * @param rawText statement text
 */
public record ImportInfo(
    String moduleSpecifier,
    List<String> namedImports,
    String defaultImport,
    boolean typeOnly,
    boolean dynamic,
    SourceLocation location,
    String rawText
) {
    public ImportInfo {
        Objects.requireNonNull(moduleSpecifier, "moduleSpecifier must not be null");
        namedImports = namedImports != null ? List.copyOf(namedImports) : List.of();
        location = location != null ? location : SourceLocation.START;
    }

    public static ImportInfo of(String moduleSpecifier, int line) {
        return new ImportInfo(moduleSpecifier, List.of(), null, false, false, SourceLocation.at(line),
            "import " + moduleSpecifier);
    }
}
