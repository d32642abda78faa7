package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code let name[: T] = expr} or {@code var name[: T] [= expr]}.
 *
 * @param name        The bound name.
 * @param mutable     true for {@code var}.
 * @param type        The annotated type, or null when inferred.
 * @param initializer The initial value, or null (only allowed for an annotated {@code var}).
 * @param source      The position of the keyword.
 */
public record VarDeclNode(String name, boolean mutable, TypeRefNode type, ExpressionNode initializer, SourceInfo source)
        implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(type, initializer);
    }
}
