package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code if/elif/else}.
 *
 * @param branches  The {@code if} arm followed by the {@code elif} arms.
 * @param elseBlock The {@code else} block, or null.
 * @param source    The position of the {@code if} keyword.
 */
public record IfNode(List<ConditionalBranch> branches, BlockNode elseBlock, SourceInfo source) implements StatementNode {

    public IfNode {
        branches = List.copyOf(branches);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(branches, elseBlock);
    }
}
