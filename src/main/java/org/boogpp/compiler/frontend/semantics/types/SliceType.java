package org.boogpp.compiler.frontend.semantics.types;

/**
 * A view of a run of elements whose length is known only at run time.
 */
public record SliceType(Type element) implements Type {

    @Override
    public String displayName() {
        return "slice[" + element.displayName() + "]";
    }

    @Override
    public String irName() {
        return "{ ptr, i64 }";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
