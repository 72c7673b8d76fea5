package com.archcodex.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Case conventions understood by structured naming specs.
 *
 * <p>Each case carries the un-anchored regex fragment used when a {@link NamingSpec}
 * is compiled.
 *
 * @since 1.0.0
 */
public enum NamingCase {
    PASCAL_CASE("PascalCase", "[A-Z][a-zA-Z0-9]*"),
    CAMEL_CASE("camelCase", "[a-z][a-zA-Z0-9]*"),
    SNAKE_CASE("snake_case", "[a-z][a-z0-9]*(?:_[a-z0-9]+)*"),
    UPPER_CASE("UPPER_CASE", "[A-Z][A-Z0-9]*(?:_[A-Z0-9]+)*"),
    KEBAB_CASE("kebab-case", "[a-z][a-z0-9]*(?:-[a-z0-9]+)*");

    private final String label;
    private final String fragment;

    NamingCase(String label, String fragment) {
        this.label = label;
        this.fragment = fragment;
    }

    public String label() {
        return label;
    }

    public String fragment() {
        return fragment;
    }

    /**
     * Looks a case up by its conventional label ("PascalCase", "kebab-case", ...).
     *
     * @param label case label
     * @return matching case, empty if unknown
     */
    public static Optional<NamingCase> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(c -> c.label.equals(label))
            .findFirst();
    }
}
