package org.boogpp.compiler.frontend.parser.ast;

/**
 * Marker for nodes that produce a value.
 */
public interface ExpressionNode extends AstNode {
}
