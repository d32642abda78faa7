package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * An assignment {@code target = value} or a compound assignment such as {@code target += value}.
 *
 * @param target   An identifier or index expression.
 * @param compound The arithmetic operator of a compound assignment, or null for plain '='.
 * @param value    The assigned value.
 * @param source   The position of the target.
 */
public record AssignNode(ExpressionNode target, BinaryOperator compound, ExpressionNode value, SourceInfo source)
        implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(target, value);
    }
}
