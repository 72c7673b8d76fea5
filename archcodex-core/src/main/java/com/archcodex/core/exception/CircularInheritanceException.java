package com.archcodex.core.exception;

import java.util.List;

/**
 * Thrown when the {@code inherits} relation loops back on itself or exceeds the depth bound.
 *
 * <p>The message carries the walked path, e.g. {@code Circular inheritance detected: a → b → a}.
 *
 * @since 1.0.0
 */
public class CircularInheritanceException extends RegistryException {

    private final List<String> path;

    public CircularInheritanceException(String archId, List<String> path) {
        super("Circular inheritance detected: " + String.join(" → ", path), archId);
        this.path = List.copyOf(path);
    }

    public CircularInheritanceException(String archId, List<String> path, int maxDepth) {
        super("Inheritance chain exceeds maximum depth of " + maxDepth + ": " + String.join(" → ", path), archId);
        this.path = List.copyOf(path);
    }

    /**
     * The chain walked before the cycle (or the depth bound) was detected.
     *
     * @return walked path, leaf first
     */
    public List<String> getPath() {
        return path;
    }
}
