package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.UnaryNode;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrValue;

public final class UnaryNodeConverter implements IAstNodeToIrConverter<UnaryNode> {

    @Override
    public IrValue convert(UnaryNode node, IrGenContext ctx) {
        IrValue operand = ctx.value(node.operand());
        Type type = ctx.typeOf(node.operand());
        switch (node.operator()) {
            case NEGATE:
                if (type.isFloat()) {
                    return ctx.binary("fsub", IrConst.floating(-0.0, type.irName()), operand, node.source());
                }
                return ctx.binary("sub", IrConst.integer(0, type.irName()), operand, node.source());
            case NOT:
                return ctx.binary("xor", operand, IrConst.TRUE, node.source());
            default:
                return ctx.binary("xor", operand, IrConst.integer(-1, type.irName()), node.source());
        }
    }
}
