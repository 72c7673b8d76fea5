package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Free function (or, for languages without free functions, a method flattened for
 * function-level checks such as intent lookup).
 *
 * @param name function name
 * @param exported visible outside the file/module
 * @param async async/coroutine function
 * @param visibility visibility
 * @param decorators decorators/annotations
 * @param parameterCount number of parameters
 * @param returnType declared return type, may be null
 * @param location declaration position
 * @param intents {@code @intent:} names in the function's doc comment
 * @param startLine first line of the function
 * @param endLine last line of the function
 */
public record FunctionInfo(
    String name,
    boolean exported,
    boolean async,
    Visibility visibility,
    List<DecoratorInfo> decorators,
    int parameterCount,
    String returnType,
    SourceLocation location,
    List<String> intents,
    int startLine,
    int endLine
) {
    public FunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        visibility = visibility != null ? visibility : Visibility.PUBLIC;
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
        location = location != null ? location : SourceLocation.at(startLine > 0 ? startLine : 1);
        intents = intents != null ? List.copyOf(intents) : List.of();
    }

    /**
     * Whether the given line falls inside this function.
     *
     * @param line 1-based line
     * @return true if {@code startLine <= line <= endLine}
     */
    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }
}
