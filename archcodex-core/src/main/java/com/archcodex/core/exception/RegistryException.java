package com.archcodex.core.exception;

/**
 * Configuration error in the architecture registry (unknown ids, broken inheritance).
 *
 * @since 1.0.0
 */
public class RegistryException extends ArchCodexException {

    private final String id;

    public RegistryException(String message, String id) {
        super(message);
        this.id = id;
    }

    /**
     * The architecture or mixin id the error refers to.
     *
     * @return offending id
     */
    public String getId() {
        return id;
    }
}
