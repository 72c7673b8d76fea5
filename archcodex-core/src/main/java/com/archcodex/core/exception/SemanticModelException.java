package com.archcodex.core.exception;

/**
 * Thrown by a semantic model adapter that cannot produce a model for a file.
 *
 * @since 1.0.0
 */
public class SemanticModelException extends ArchCodexException {

    private final String filePath;

    public SemanticModelException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    public SemanticModelException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }
}
