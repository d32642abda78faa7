package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;
import java.util.Optional;

/**
 * The {@code try_chain} resilience construct: clauses evaluated in source order, each later clause
 * running only when the previous one reported a failure status.
 *
 * @param clauses The primary clause, the secondary clauses and the fallback, in order.
 * @param source  The position of the keyword.
 */
public record TryChainNode(List<TryClause> clauses, SourceInfo source) implements ExpressionNode {

    public TryChainNode {
        clauses = List.copyOf(clauses);
    }

    /**
     * @return The fallback clause; absent only in a chain that failed to parse.
     */
    public Optional<TryClause> fallback() {
        return clauses.stream().filter(c -> c.kind() == TryClause.Kind.FALLBACK).findFirst();
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(clauses);
    }
}
