package org.boogpp.compiler.frontend.semantics.types;

import java.util.List;
import java.util.stream.Collectors;

public record TupleType(List<Type> elements) implements Type {

    public TupleType {
        elements = List.copyOf(elements);
    }

    public static TupleType of(Type... elements) {
        return new TupleType(List.of(elements));
    }

    @Override
    public String displayName() {
        return elements.stream().map(Type::displayName).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String irName() {
        return elements.stream().map(Type::irName).collect(Collectors.joining(", ", "{ ", " }"));
    }

    @Override
    public String toString() {
        return displayName();
    }
}
