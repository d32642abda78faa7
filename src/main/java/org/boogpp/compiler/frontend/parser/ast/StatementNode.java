package org.boogpp.compiler.frontend.parser.ast;

/**
 * Marker for nodes that may appear as a statement of a block.
 */
public interface StatementNode extends AstNode {
}
