package com.archcodex.core.validation;

/**
 * Overall outcome of validating one file.
 *
 * @since 1.0.0
 */
public enum ValidationStatus {
    /** No errors or warnings */
    PASS,
    /** Warnings only */
    WARN,
    /** At least one error */
    FAIL,
    /** Not validated, e.g. an untagged file under the {@code allow} policy */
    SKIPPED,
    /** Validation could not run: resolution, adapter or internal failure */
    ERROR
}
