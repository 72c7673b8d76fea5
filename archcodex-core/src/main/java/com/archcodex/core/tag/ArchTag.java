package com.archcodex.core.tag;

import java.util.List;
import java.util.Objects;

/**
 * The {@code @arch <id> [+mixin ...]} tag of a file.
 *
 * @param archId tagged architecture id
 * @param inlineMixins use-site mixins, in tag order
 * @param line 1-based line of the tag
 * @param column 1-based column of {@code @arch}
 */
public record ArchTag(
    String archId,
    List<String> inlineMixins,
    int line,
    int column
) {
    public ArchTag {
        Objects.requireNonNull(archId, "archId must not be null");
        inlineMixins = inlineMixins != null ? List.copyOf(inlineMixins) : List.of();
    }
}
