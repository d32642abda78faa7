package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code target.member}: either a module-qualified name or a {@code result} field.
 *
 * @param target The expression left of the dot.
 * @param member The name right of the dot.
 * @param source The position of the dot.
 */
public record MemberAccessNode(ExpressionNode target, String member, SourceInfo source) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(target);
    }
}
