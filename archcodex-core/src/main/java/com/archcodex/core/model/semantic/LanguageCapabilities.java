package com.archcodex.core.model.semantic;

import java.util.Collection;

/**
 * Capability flags published by a semantic model adapter for its language.
 *
 * @param hasClassInheritance classes can extend a base class
 * @param hasInterfaces classes can implement interfaces
 * @param hasDecorators classes and functions can carry decorators or annotations
 * @param hasVisibilityModifiers members carry explicit visibility
 */
public record LanguageCapabilities(
    boolean hasClassInheritance,
    boolean hasInterfaces,
    boolean hasDecorators,
    boolean hasVisibilityModifiers
) {
    public static LanguageCapabilities all() {
        return new LanguageCapabilities(true, true, true, true);
    }

    public static LanguageCapabilities none() {
        return new LanguageCapabilities(false, false, false, false);
    }

    public boolean supports(Capability capability) {
        return switch (capability) {
            case CLASS_INHERITANCE -> hasClassInheritance;
            case INTERFACES -> hasInterfaces;
            case DECORATORS -> hasDecorators;
            case VISIBILITY_MODIFIERS -> hasVisibilityModifiers;
        };
    }

    public boolean supportsAll(Collection<Capability> capabilities) {
        return capabilities.stream().allMatch(this::supports);
    }
}
