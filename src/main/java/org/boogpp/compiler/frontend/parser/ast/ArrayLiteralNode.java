package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code [a, b, c]}: a fixed-size array whose length is the number of elements.
 */
public record ArrayLiteralNode(List<ExpressionNode> elements, SourceInfo source) implements ExpressionNode {

    public ArrayLiteralNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(elements);
    }
}
