package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.BlockNode;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts the statements of a nested block in order.
 */
public final class BlockNodeConverter implements IAstNodeToIrConverter<BlockNode> {

    @Override
    public IrValue convert(BlockNode node, IrGenContext ctx) {
        ctx.statements(node.statements());
        return null;
    }
}
