package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

public record UnaryNode(UnaryOperator operator, ExpressionNode operand, SourceInfo source) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(operand);
    }
}
