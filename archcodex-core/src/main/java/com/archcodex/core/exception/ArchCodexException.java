package com.archcodex.core.exception;

/**
 * Base class for every failure raised by the ArchCodex core.
 *
 * <p>All exceptions are unchecked. The resolver and the validators never catch them;
 * the validation orchestrator is the single place that turns them into result statuses.
 *
 * @since 1.0.0
 */
public class ArchCodexException extends RuntimeException {

    public ArchCodexException(String message) {
        super(message);
    }

    public ArchCodexException(String message, Throwable cause) {
        super(message, cause);
    }
}
