package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * A parenthesized, comma separated list of values, e.g. {@code (SUCCESS, "done")}.
 */
public record TupleNode(List<ExpressionNode> elements, SourceInfo source) implements ExpressionNode {

    public TupleNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(elements);
    }
}
