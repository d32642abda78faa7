package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code for variable in iterable:}. The iterable is either a {@code range(...)} call or an array.
 *
 * @param variable The loop variable, immutable inside the body.
 * @param iterable The iterated expression.
 * @param body     The loop body.
 * @param source   The position of the {@code for} keyword.
 */
public record ForNode(String variable, ExpressionNode iterable, BlockNode body, SourceInfo source) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(iterable, body);
    }
}
