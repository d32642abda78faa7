package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * One {@code if} or {@code elif} arm.
 *
 * @param condition The guard.
 * @param body      The statements executed when the guard holds.
 * @param source    The position of the keyword.
 */
public record ConditionalBranch(ExpressionNode condition, BlockNode body, SourceInfo source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(condition, body);
    }
}
