package com.archcodex.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known intent definitions, keyed by lowercase name.
 *
 * <p>An empty registry means "intents are not governed": undefined-intent checks are skipped.
 */
public final class IntentRegistry {

    private static final IntentRegistry EMPTY = new IntentRegistry(Map.of());

    private final Map<String, IntentDefinition> definitions;

    private IntentRegistry(Map<String, IntentDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static IntentRegistry empty() {
        return EMPTY;
    }

    public static IntentRegistry of(Collection<IntentDefinition> definitions) {
        Map<String, IntentDefinition> byName = new LinkedHashMap<>();
        for (IntentDefinition definition : definitions) {
            byName.put(definition.name().toLowerCase(Locale.ROOT), definition);
        }
        return new IntentRegistry(byName);
    }

    public Optional<IntentDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean isDefined(String name) {
        return definitions.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public Set<String> names() {
        return definitions.keySet();
    }
}
