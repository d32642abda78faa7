package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * @return The position of the first token of this node.
     */
    SourceInfo source();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Collects child nodes in order, flattening collections and skipping absent (null) parts.
     * @param parts Nodes or collections of nodes.
     * @return The flattened list of children.
     */
    static List<AstNode> childrenOf(Object... parts) {
        List<AstNode> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                children.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof AstNode node) {
                        children.add(node);
                    }
                }
            }
        }
        return children;
    }
}
