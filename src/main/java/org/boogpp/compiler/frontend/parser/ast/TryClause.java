package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * One clause of a {@code try_chain}.
 *
 * @param kind   The clause role.
 * @param body   The statements run before the value is taken, or null for an inline clause.
 * @param value  The clause value, or null if the block ends with a non-expression statement.
 * @param source The position of the clause keyword.
 */
public record TryClause(Kind kind, BlockNode body, ExpressionNode value, SourceInfo source) implements AstNode {

    public enum Kind {
        PRIMARY, SECONDARY, FALLBACK
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(body, value);
    }
}
