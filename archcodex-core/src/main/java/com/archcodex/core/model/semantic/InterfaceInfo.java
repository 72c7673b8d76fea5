package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Interface declared in a file.
 *
 * @param name simple name
 * @param exported visible outside the file/module
 * @param extendsInterfaces extended interfaces
 * @param methods declared methods
 * @param location declaration position
 */
public record InterfaceInfo(
    String name,
    boolean exported,
    List<String> extendsInterfaces,
    List<MethodInfo> methods,
    SourceLocation location
) {
    public InterfaceInfo {
        Objects.requireNonNull(name, "name must not be null");
        extendsInterfaces = extendsInterfaces != null ? List.copyOf(extendsInterfaces) : List.of();
        methods = methods != null ? List.copyOf(methods) : List.of();
        location = location != null ? location : SourceLocation.START;
    }
}
