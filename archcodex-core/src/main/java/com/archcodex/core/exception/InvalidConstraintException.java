package com.archcodex.core.exception;

/**
 * Thrown when a constraint payload cannot be compiled, e.g. an empty structured naming spec.
 *
 * <p>Validators report such problems as violations; this exception is raised by the
 * programmatic helpers ({@code NamingPatternCompiler}, {@code PatternSupport}) when called directly.
 *
 * @since 1.0.0
 */
public class InvalidConstraintException extends ArchCodexException {

    public InvalidConstraintException(String message) {
        super(message);
    }

    public InvalidConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
