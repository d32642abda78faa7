package org.boogpp.compiler.frontend.semantics.types;

public record VoidType() implements Type {

    @Override
    public String displayName() {
        return "void";
    }

    @Override
    public String irName() {
        return "void";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
