package org.boogpp.compiler.frontend.semantics.types;

/**
 * A status code paired with a value: {@code result[T]}.
 */
public record ResultType(Type inner) implements Type {

    @Override
    public String displayName() {
        return "result[" + inner.displayName() + "]";
    }

    @Override
    public String irName() {
        return "{ i32, " + inner.irName() + " }";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
