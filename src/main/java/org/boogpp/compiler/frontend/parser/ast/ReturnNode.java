package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code return [value, ...]}. A multi-return function may return several comma separated
 * values or a single parenthesized tuple.
 *
 * @param values The returned values; empty for a bare return.
 * @param source The position of the keyword.
 */
public record ReturnNode(List<ExpressionNode> values, SourceInfo source) implements StatementNode {

    public ReturnNode {
        values = List.copyOf(values);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(values);
    }
}
