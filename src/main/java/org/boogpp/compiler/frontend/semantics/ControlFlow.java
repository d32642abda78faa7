package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.BlockNode;
import org.boogpp.compiler.frontend.parser.ast.BreakNode;
import org.boogpp.compiler.frontend.parser.ast.CaseNode;
import org.boogpp.compiler.frontend.parser.ast.ConditionalBranch;
import org.boogpp.compiler.frontend.parser.ast.ForNode;
import org.boogpp.compiler.frontend.parser.ast.IfNode;
import org.boogpp.compiler.frontend.parser.ast.LiteralNode;
import org.boogpp.compiler.frontend.parser.ast.MatchNode;
import org.boogpp.compiler.frontend.parser.ast.ReturnNode;
import org.boogpp.compiler.frontend.parser.ast.StatementNode;
import org.boogpp.compiler.frontend.parser.ast.WhileNode;

/**
 * Conservative return analysis over statement blocks.
 */
final class ControlFlow {

    private ControlFlow() {}

    /**
     * @param block A function body or a nested block.
     * @return true if every path through the block ends in a return statement.
     */
    static boolean alwaysReturns(BlockNode block) {
        for (StatementNode statement : block.statements()) {
            if (alwaysReturns(statement)) {
                return true;
            }
        }
        return false;
    }

    private static boolean alwaysReturns(StatementNode statement) {
        if (statement instanceof ReturnNode) {
            return true;
        }
        if (statement instanceof BlockNode block) {
            return alwaysReturns(block);
        }
        if (statement instanceof IfNode ifNode) {
            if (ifNode.elseBlock() == null || !alwaysReturns(ifNode.elseBlock())) {
                return false;
            }
            for (ConditionalBranch branch : ifNode.branches()) {
                if (!alwaysReturns(branch.body())) {
                    return false;
                }
            }
            return true;
        }
        if (statement instanceof MatchNode match) {
            boolean wildcard = false;
            boolean trueCase = false;
            boolean falseCase = false;
            for (CaseNode caseNode : match.cases()) {
                if (!alwaysReturns(caseNode.body())) {
                    return false;
                }
                wildcard |= caseNode.isWildcard();
                if (!caseNode.isRange() && caseNode.pattern() instanceof LiteralNode literal) {
                    trueCase |= Boolean.TRUE.equals(literal.value());
                    falseCase |= Boolean.FALSE.equals(literal.value());
                }
            }
            return wildcard || (trueCase && falseCase);
        }
        if (statement instanceof WhileNode loop) {
            // An endless loop only leaves through a return.
            return loop.condition() instanceof LiteralNode literal
                    && Boolean.TRUE.equals(literal.value())
                    && !breaksOut(loop.body());
        }
        return false;
    }

    /**
     * @return true if a break inside the node leaves the loop owning it, ignoring nested loops.
     */
    private static boolean breaksOut(AstNode node) {
        if (node instanceof BreakNode) {
            return true;
        }
        if (node instanceof WhileNode || node instanceof ForNode) {
            return false;
        }
        for (AstNode child : node.getChildren()) {
            if (breaksOut(child)) {
                return true;
            }
        }
        return false;
    }
}
