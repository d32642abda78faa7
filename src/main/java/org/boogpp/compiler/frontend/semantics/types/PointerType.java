package org.boogpp.compiler.frontend.semantics.types;

/**
 * A raw pointer. Only permitted where the safety mode allows pointer use.
 */
public record PointerType(Type target) implements Type {

    @Override
    public String displayName() {
        return "ptr[" + target.displayName() + "]";
    }

    @Override
    public String irName() {
        return "ptr";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
