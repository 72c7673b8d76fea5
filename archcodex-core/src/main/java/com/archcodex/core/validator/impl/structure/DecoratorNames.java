package com.archcodex.core.validator.impl.structure;

final class DecoratorNames {

    private DecoratorNames() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static String bare(String decorator) {
        String trimmed = decorator.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }
}
