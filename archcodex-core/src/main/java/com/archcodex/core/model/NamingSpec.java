package com.archcodex.core.model;

/**
 * Structured file naming spec: literal prefix + case pattern + literal suffix + literal extension.
 *
 * <p>All fields are optional, but a spec with none of them set is invalid and is reported
 * as such by the naming validator. When only affixes are given, the case defaults to
 * {@link NamingCase#PASCAL_CASE}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * NamingSpec spec = new NamingSpec(NamingCase.PASCAL_CASE, null, "Service", ".ts");
 * // compiles to ^[A-Z][a-zA-Z0-9]*Service\.ts$
 * }</pre>
 *
 * @param caseStyle case convention, may be null
 * @param prefix literal prefix, may be null
 * @param suffix literal suffix, may be null
 * @param extension literal extension including the dot, may be null
 */
public record NamingSpec(
    NamingCase caseStyle,
    String prefix,
    String suffix,
    String extension
) {
    /**
     * Whether no field is set at all.
     *
     * @return true for an empty (invalid) spec
     */
    public boolean isEmpty() {
        return caseStyle == null && isBlank(prefix) && isBlank(suffix) && isBlank(extension);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
