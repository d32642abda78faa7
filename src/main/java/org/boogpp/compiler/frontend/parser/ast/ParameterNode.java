package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function parameter with its declared type.
 *
 * @param name   The parameter name.
 * @param type   The declared type.
 * @param source The position of the name.
 */
public record ParameterNode(String name, TypeRefNode type, SourceInfo source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(type);
    }
}
