package com.archcodex.core.model.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Assignment, compound assignment, increment or delete of a property path.
 *
 * @param target full target, e.g. {@code window.location.href}
 * @param rootObject first path segment, e.g. {@code window}
 * @param propertyPath remaining segments
 * @param operator operator text ({@code =}, {@code +=}, {@code ++}, {@code delete})
 * @param location position
 * @param rawText source text
 * @param isDelete property deletion
 */
public record MutationInfo(
    String target,
    String rootObject,
    List<String> propertyPath,
    String operator,
    SourceLocation location,
    String rawText,
    boolean isDelete
) {
    public MutationInfo {
        Objects.requireNonNull(target, "target must not be null");
        propertyPath = propertyPath != null ? List.copyOf(propertyPath) : List.of();
        location = location != null ? location : SourceLocation.START;
        if (rootObject == null) {
            int dot = target.indexOf('.');
            rootObject = dot > 0 ? target.substring(0, dot) : target;
        }
    }
}
