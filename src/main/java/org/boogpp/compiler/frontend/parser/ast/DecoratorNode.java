package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.parser.DecoratorKind;

import java.util.List;
import java.util.Optional;

/**
 * A validated decorator: a known kind plus its named arguments in source order.
 *
 * @param kind      The decorator kind.
 * @param arguments The arguments, each naming an option of the kind.
 * @param source    The position of the '@'.
 */
public record DecoratorNode(DecoratorKind kind, List<DecoratorArgument> arguments, SourceInfo source) implements AstNode {

    public DecoratorNode {
        arguments = List.copyOf(arguments);
    }

    /**
     * @param option The option name.
     * @return The argument given for the option, if any.
     */
    public Optional<DecoratorArgument> argument(String option) {
        return arguments.stream().filter(a -> a.name().equals(option)).findFirst();
    }
}
