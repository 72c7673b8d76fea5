package com.archcodex.core.exception;

/**
 * Thrown when an architecture id (requested directly or named as a parent) is not in the registry.
 *
 * @since 1.0.0
 */
public class ArchitectureNotFoundException extends RegistryException {

    public ArchitectureNotFoundException(String archId) {
        super("Architecture '" + archId + "' not found in registry", archId);
    }
}
