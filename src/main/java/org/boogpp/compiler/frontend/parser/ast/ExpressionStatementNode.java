package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

public record ExpressionStatementNode(ExpressionNode expression, SourceInfo source) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(expression);
    }
}
