package com.archcodex.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reusable, non-inheriting constraint bundle.
 *
 * <p>Mixins are applied by the architectures that list them, or at use-site through
 * {@code @arch some.arch +mixinId}. They never reference other mixins.
 *
 * @param mixinId mixin id
 * @param description short description
 * @param rationale why the bundle exists
 * @param constraints constraints contributed, tagged {@code mixin:<id>} on resolution
 * @param hints guidance
 * @param pointers documentation references
 * @param inline whether use-site application is allowed, required or forbidden
 */
public record Mixin(
    String mixinId,
    String description,
    String rationale,
    List<Constraint> constraints,
    List<Hint> hints,
    List<Pointer> pointers,
    InlineMode inline
) {
    public Mixin {
        Objects.requireNonNull(mixinId, "mixinId must not be null");
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        hints = hints != null ? List.copyOf(hints) : List.of();
        pointers = pointers != null ? List.copyOf(pointers) : List.of();
        inline = inline != null ? inline : InlineMode.ALLOWED;
    }

    /**
     * Provenance tag used on constraints contributed by this mixin.
     *
     * @return {@code mixin:<id>}
     */
    public String sourceTag() {
        return "mixin:" + mixinId;
    }

    public static Builder builder(String mixinId) {
        return new Builder(mixinId);
    }

    /**
     * Fluent builder for mixins.
     */
    public static final class Builder {
        private final String mixinId;
        private String description;
        private String rationale;
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<Hint> hints = new ArrayList<>();
        private final List<Pointer> pointers = new ArrayList<>();
        private InlineMode inline = InlineMode.ALLOWED;

        private Builder(String mixinId) {
            this.mixinId = mixinId;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder constraint(Constraint constraint) {
            this.constraints.add(constraint);
            return this;
        }

        public Builder hint(String text) {
            this.hints.add(Hint.of(text));
            return this;
        }

        public Builder pointer(Pointer pointer) {
            this.pointers.add(pointer);
            return this;
        }

        public Builder inline(InlineMode inline) {
            this.inline = inline;
            return this;
        }

        public Mixin build() {
            return new Mixin(mixinId, description, rationale, constraints, hints, pointers, inline);
        }
    }
}
