package com.archcodex.core.exception;

/**
 * Thrown when an architecture (or a use-site tag) references a mixin the registry does not define.
 *
 * @since 1.0.0
 */
public class MixinNotFoundException extends RegistryException {

    private final String archId;

    public MixinNotFoundException(String mixinId, String archId) {
        super("Mixin '" + mixinId + "' referenced by '" + archId + "' not found in registry", mixinId);
        this.archId = archId;
    }

    public String getArchId() {
        return archId;
    }
}
