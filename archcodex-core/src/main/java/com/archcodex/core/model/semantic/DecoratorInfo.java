package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Decorator or annotation applied to a class, method or function.
 *
 * @param name name without the leading {@code @}
 * @param arguments raw argument texts
 * @param location position
 * @param rawText source text
 */
public record DecoratorInfo(
    String name,
    List<String> arguments,
    SourceLocation location,
    String rawText
) {
    public DecoratorInfo {
        Objects.requireNonNull(name, "name must not be null");
        name = name.startsWith("@") ? name.substring(1) : name;
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
        location = location != null ? location : SourceLocation.START;
    }

    public static DecoratorInfo of(String name) {
        return new DecoratorInfo(name, List.of(), null, "@" + name);
    }
}
