package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * A binary operation.
 *
 * @param left     The left operand.
 * @param operator The operator.
 * @param right    The right operand.
 * @param source   The position of the operator.
 */
public record BinaryNode(ExpressionNode left, BinaryOperator operator, ExpressionNode right, SourceInfo source)
        implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(left, right);
    }
}
