package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;
import java.util.Optional;

/**
 * A call of a function, a built-in or an external runtime/OS function.
 *
 * @param callee    The called expression; an identifier or a dotted name.
 * @param arguments The arguments in order.
 * @param source    The position of the callee.
 */
public record CallNode(ExpressionNode callee, List<ExpressionNode> arguments, SourceInfo source) implements ExpressionNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    /**
     * @return The dotted name of the callee as written, e.g. {@code proc.inject_dll}.
     */
    public Optional<String> calleeName() {
        return dottedName(callee);
    }

    /**
     * Renders an identifier or a chain of member accesses as a dotted name.
     * @param expression The expression.
     * @return The dotted name, or empty if the expression is anything else.
     */
    public static Optional<String> dottedName(ExpressionNode expression) {
        if (expression instanceof IdentifierNode id) {
            return Optional.of(id.name());
        }
        if (expression instanceof MemberAccessNode access) {
            return dottedName(access.target()).map(prefix -> prefix + "." + access.member());
        }
        return Optional.empty();
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(callee, arguments);
    }
}
