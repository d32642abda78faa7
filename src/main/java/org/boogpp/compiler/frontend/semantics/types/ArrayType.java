package org.boogpp.compiler.frontend.semantics.types;

/**
 * A fixed-size array.
 *
 * @param element The element type.
 * @param size    The number of elements.
 */
public record ArrayType(Type element, long size) implements Type {

    @Override
    public String displayName() {
        return "array[" + element.displayName() + ", " + size + "]";
    }

    @Override
    public String irName() {
        return "[" + size + " x " + element.irName() + "]";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
