package org.boogpp.compiler.frontend;

import org.boogpp.compiler.frontend.parser.ast.AstNode;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Pre-order traversal of a function body that dispatches each node to the handler registered
 * for its exact class. Nodes without a handler are passed through; their children are still
 * visited.
 * <p>
 * Passes register only the node kinds they care about, so adding a node type to the AST does not
 * touch passes that ignore it:
 * <pre>{@code
 * new TreeWalker()
 *         .on(CallNode.class, this::checkCall)
 *         .on(IndexNode.class, this::checkIndex)
 *         .walk(function.body());
 * }</pre>
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();

    /**
     * Registers the handler for one node class, replacing an earlier one.
     * @param type The node class.
     * @param handler Called with every node of that class, before its children.
     * @return This walker.
     */
    public <T extends AstNode> TreeWalker on(Class<T> type, Consumer<? super T> handler) {
        handlers.put(type, node -> handler.accept(type.cast(node)));
        return this;
    }

    /**
     * Walks a node and everything below it, in source order.
     * @param node The root, may be null.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }
        Consumer<AstNode> handler = handlers.get(node.getClass());
        if (handler != null) {
            handler.accept(node);
        }
        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
