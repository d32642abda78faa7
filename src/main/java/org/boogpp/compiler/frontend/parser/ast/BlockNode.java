package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * An indented sequence of statements.
 *
 * @param statements The statements in order.
 * @param source     The position of the first statement.
 */
public record BlockNode(List<StatementNode> statements, SourceInfo source) implements StatementNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(statements);
    }
}
