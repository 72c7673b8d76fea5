package com.archcodex.core.tag;

import java.util.List;
import java.util.Optional;

/**
 * Everything {@link ArchTagParser} extracted from one file.
 *
 * @param archTag the architecture tag, null for untagged files
 * @param overrides override blocks in source order
 * @param intents file-level intents in source order
 */
public record ParsedTags(
    ArchTag archTag,
    List<OverrideAnnotation> overrides,
    List<IntentAnnotation> intents
) {
    public ParsedTags {
        overrides = overrides != null ? List.copyOf(overrides) : List.of();
        intents = intents != null ? List.copyOf(intents) : List.of();
    }

    public Optional<ArchTag> tag() {
        return Optional.ofNullable(archTag);
    }

    public boolean isTagged() {
        return archTag != null;
    }

    public List<String> intentNames() {
        return intents.stream().map(IntentAnnotation::name).distinct().toList();
    }
}
