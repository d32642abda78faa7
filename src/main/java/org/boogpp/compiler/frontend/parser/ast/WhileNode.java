package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

public record WhileNode(ExpressionNode condition, BlockNode body, SourceInfo source) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(condition, body);
    }
}
