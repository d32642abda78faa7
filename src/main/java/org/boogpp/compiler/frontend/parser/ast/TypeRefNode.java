package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A type as written in the source, resolved later by the type checker.
 *
 * @param name          The base name ({@code i32}, {@code ptr}, {@code array}, {@code tuple}, ...).
 * @param typeArguments The element types of constructed types.
 * @param size          The length of an {@code array[T, N]}, otherwise null.
 * @param source        The position of the type.
 */
public record TypeRefNode(String name, List<TypeRefNode> typeArguments, Long size, SourceInfo source) implements AstNode {

    public TypeRefNode {
        typeArguments = List.copyOf(typeArguments);
    }

    /**
     * Creates a reference to a type without arguments.
     * @param name The type name.
     * @param source The position.
     * @return The type reference.
     */
    public static TypeRefNode simple(String name, SourceInfo source) {
        return new TypeRefNode(name, List.of(), null, source);
    }

    /**
     * @return true if this reference, or any nested one, names a pointer type.
     */
    public boolean mentionsPointer() {
        return "ptr".equals(name) || typeArguments.stream().anyMatch(TypeRefNode::mentionsPointer);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(typeArguments);
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return name;
        }
        String args = typeArguments.stream().map(TypeRefNode::toString).collect(Collectors.joining(", "));
        if ("tuple".equals(name)) {
            return "(" + args + ")";
        }
        return name + "[" + args + (size != null ? ", " + size : "") + "]";
    }
}
