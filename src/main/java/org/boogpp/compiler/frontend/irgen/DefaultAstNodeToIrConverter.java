package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.ir.IrValue;

/**
 * Fallback converter. Every node kind the checkers accept has a registered converter, so
 * reaching this one is a generator bug.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

    @Override
    public IrValue convert(AstNode node, IrGenContext ctx) {
        throw new InternalCompilerError("No IR converter for " + node.getClass().getSimpleName(), node.source());
    }
}
