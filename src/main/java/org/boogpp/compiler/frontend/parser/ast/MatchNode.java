package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

public record MatchNode(ExpressionNode subject, List<CaseNode> cases, SourceInfo source) implements StatementNode {

    public MatchNode {
        cases = List.copyOf(cases);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(subject, cases);
    }
}
