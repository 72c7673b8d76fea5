package com.archcodex.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of architecture and mixin definitions.
 *
 * <p>The registry is produced by an external loader; this core only reads it. Iteration order
 * is insertion order so everything derived from a registry is deterministic.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Registry registry = Registry.builder()
 *     .architecture(ArchitectureNode.builder("base").build())
 *     .architecture(ArchitectureNode.builder("svc.payment").inherits("base").build())
 *     .mixin(Mixin.builder("tested").build())
 *     .build();
 * }</pre>
 *
 * @param architectures archId to definition
 * @param mixins mixinId to definition
 */
public record Registry(
    Map<String, ArchitectureNode> architectures,
    Map<String, Mixin> mixins
) {
    public Registry {
        architectures = architectures != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(architectures))
            : Map.of();
        mixins = mixins != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(mixins))
            : Map.of();
    }

    public static Registry empty() {
        return new Registry(Map.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ArchitectureNode> findArchitecture(String archId) {
        return Optional.ofNullable(architectures.get(archId));
    }

    public Optional<Mixin> findMixin(String mixinId) {
        return Optional.ofNullable(mixins.get(mixinId));
    }

    public boolean hasArchitecture(String archId) {
        return architectures.containsKey(archId);
    }

    public Set<String> architectureIds() {
        return architectures.keySet();
    }

    /**
     * Fluent builder; later definitions with the same id replace earlier ones.
     */
    public static final class Builder {
        private final Map<String, ArchitectureNode> architectures = new LinkedHashMap<>();
        private final Map<String, Mixin> mixins = new LinkedHashMap<>();

        public Builder architecture(ArchitectureNode node) {
            Objects.requireNonNull(node, "node must not be null");
            architectures.put(node.archId(), node);
            return this;
        }

        public Builder mixin(Mixin mixin) {
            Objects.requireNonNull(mixin, "mixin must not be null");
            mixins.put(mixin.mixinId(), mixin);
            return this;
        }

        public Registry build() {
            return new Registry(architectures, mixins);
        }
    }
}
