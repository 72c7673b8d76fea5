package com.archcodex.core.validation;

import java.util.Objects;

/**
 * A file handed to batch validation.
 *
 * @param path file path, relative to the project root where one is configured
 * @param content file content
 */
public record SourceFile(String path, String content) {
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
