package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Method declared on a class or interface.
 *
 * @param name method name
 * @param visibility visibility
 * @param isStatic static method
 * @param isAbstract abstract method
 * @param decorators decorators/annotations
 * @param parameterCount number of parameters
 * @param returnType declared return type, may be null
 * @param location declaration position
 * @param intents {@code @intent:} names in the method's doc comment
 * @param startLine first line of the body
 * @param endLine last line of the body
 */
public record MethodInfo(
    String name,
    Visibility visibility,
    boolean isStatic,
    boolean isAbstract,
    List<DecoratorInfo> decorators,
    int parameterCount,
    String returnType,
    SourceLocation location,
    List<String> intents,
    int startLine,
    int endLine
) {
    public MethodInfo {
        Objects.requireNonNull(name, "name must not be null");
        visibility = visibility != null ? visibility : Visibility.PUBLIC;
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
        location = location != null ? location : SourceLocation.START;
        intents = intents != null ? List.copyOf(intents) : List.of();
    }

    public static MethodInfo of(String name, Visibility visibility) {
        return new MethodInfo(name, visibility, false, false, List.of(), 0, null, null, List.of(), 0, 0);
    }
}
