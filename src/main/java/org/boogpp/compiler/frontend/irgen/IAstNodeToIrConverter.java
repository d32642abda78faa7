package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts a specific AST node type into IR.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete AST node type handled by this converter.
 */
@FunctionalInterface
public interface IAstNodeToIrConverter<T extends AstNode> {

    /**
     * Converts the given AST node into IR and emits results via the provided context.
     *
     * @param node The AST node to convert.
     * @param ctx  The IR generation context used to emit instructions and access diagnostics.
     * @return The value an expression produces, or null for statements and void calls.
     */
    IrValue convert(T node, IrGenContext ctx);
}
