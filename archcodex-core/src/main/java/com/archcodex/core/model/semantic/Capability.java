package com.archcodex.core.model.semantic;

/**
 * Language features a constraint validator may depend on.
 *
 * <p>Validators declare the capabilities they need; the orchestrator skips a constraint
 * as inapplicable when the file's language lacks one.
 */
public enum Capability {
    CLASS_INHERITANCE,
    INTERFACES,
    DECORATORS,
    VISIBILITY_MODIFIERS
}
