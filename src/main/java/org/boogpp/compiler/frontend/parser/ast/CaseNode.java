package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * One arm of a {@code match}.
 *
 * @param pattern  The constant pattern or the lower bound of a range; null for {@code case _}.
 * @param rangeEnd The inclusive upper bound of a range pattern, or null.
 * @param body     The arm body.
 * @param source   The position of the {@code case} keyword.
 */
public record CaseNode(ExpressionNode pattern, ExpressionNode rangeEnd, BlockNode body, SourceInfo source) implements AstNode {

    public boolean isWildcard() {
        return pattern == null;
    }

    public boolean isRange() {
        return rangeEnd != null;
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(pattern, rangeEnd, body);
    }
}
