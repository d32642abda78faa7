package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

/**
 * An AST node that represents a reference to a name: a local, a parameter,
 * a function or a built-in constant.
 *
 * @param name   The referenced name.
 * @param source The position of the name.
 */
public record IdentifierNode(String name, SourceInfo source) implements ExpressionNode {
    // This node has no children and inherits the empty list from getChildren().
}
