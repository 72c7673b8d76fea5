package com.archcodex.core.model.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Class declared in a file.
 *
 * @param name simple class name
 * @param exported visible outside the file/module
 * @param extendsClass direct base class as written (generics included), may be null
 * @param inheritanceChain resolved ancestors, nearest first, when the adapter can resolve them
 * @param implementsInterfaces implemented interfaces as written
 * @param decorators class-level decorators/annotations
 * @param methods declared methods
 * @param isAbstract abstract class
 * @param location declaration position
 */
public record ClassInfo(
    String name,
    boolean exported,
    String extendsClass,
    List<String> inheritanceChain,
    List<String> implementsInterfaces,
    List<DecoratorInfo> decorators,
    List<MethodInfo> methods,
    boolean isAbstract,
    SourceLocation location
) {
    public ClassInfo {
        Objects.requireNonNull(name, "name must not be null");
        inheritanceChain = inheritanceChain != null ? List.copyOf(inheritanceChain) : List.of();
        implementsInterfaces = implementsInterfaces != null ? List.copyOf(implementsInterfaces) : List.of();
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
        methods = methods != null ? List.copyOf(methods) : List.of();
        location = location != null ? location : SourceLocation.START;
    }

    public boolean hasDecorator(String decoratorName) {
        String bare = decoratorName.startsWith("@") ? decoratorName.substring(1) : decoratorName;
        return decorators.stream().anyMatch(d -> d.name().equals(bare));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder, mainly for adapters that discover members incrementally.
     */
    public static final class Builder {
        private final String name;
        private boolean exported = true;
        private String extendsClass;
        private final List<String> inheritanceChain = new ArrayList<>();
        private final List<String> implementsInterfaces = new ArrayList<>();
        private final List<DecoratorInfo> decorators = new ArrayList<>();
        private final List<MethodInfo> methods = new ArrayList<>();
        private boolean isAbstract;
        private SourceLocation location;

        private Builder(String name) {
            this.name = name;
        }

        public Builder exported(boolean exported) {
            this.exported = exported;
            return this;
        }

        public Builder extendsClass(String extendsClass) {
            this.extendsClass = extendsClass;
            return this;
        }

        public Builder inheritanceChain(List<String> chain) {
            this.inheritanceChain.addAll(chain);
            return this;
        }

        public Builder implementsInterface(String iface) {
            this.implementsInterfaces.add(iface);
            return this;
        }

        public Builder decorator(DecoratorInfo decorator) {
            this.decorators.add(decorator);
            return this;
        }

        public Builder method(MethodInfo method) {
            this.methods.add(method);
            return this;
        }

        public Builder isAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public ClassInfo build() {
            return new ClassInfo(name, exported, extendsClass, inheritanceChain, implementsInterfaces,
                decorators, methods, isAbstract, location);
        }
    }
}
