package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.parser.DecoratorKind;

import java.util.List;
import java.util.Optional;

/**
 * A top-level function declaration.
 *
 * @param name        The function name.
 * @param parameters  The parameters in order.
 * @param returnTypes The declared return types; empty for {@code void}, more than one for multi-return.
 * @param body        The function body.
 * @param decorators  The decorators written above the function, in source order.
 * @param source      The position of the {@code func} keyword.
 */
public record FunctionDeclNode(
        String name,
        List<ParameterNode> parameters,
        List<TypeRefNode> returnTypes,
        BlockNode body,
        List<DecoratorNode> decorators,
        SourceInfo source
) implements AstNode {

    public FunctionDeclNode {
        parameters = List.copyOf(parameters);
        returnTypes = List.copyOf(returnTypes);
        decorators = List.copyOf(decorators);
    }

    /**
     * @param kind The decorator kind.
     * @return true if the function carries a decorator of that kind.
     */
    public boolean hasDecorator(DecoratorKind kind) {
        return decorators.stream().anyMatch(d -> d.kind() == kind);
    }

    /**
     * @param kind The decorator kind.
     * @return The first decorator of that kind.
     */
    public Optional<DecoratorNode> decorator(DecoratorKind kind) {
        return decorators.stream().filter(d -> d.kind() == kind).findFirst();
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(decorators, parameters, returnTypes, body);
    }
}
