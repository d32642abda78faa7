package org.boogpp.compiler.frontend.semantics.types;

/**
 * The placeholder for a type that could not be determined. It is compatible with every
 * type so that one error does not cascade, and never survives a successful check.
 */
public record UnknownType() implements Type {

    @Override
    public String displayName() {
        return "<unknown>";
    }

    @Override
    public String irName() {
        throw new IllegalStateException("Unknown type reached code generation");
    }

    @Override
    public String toString() {
        return displayName();
    }
}
