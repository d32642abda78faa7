package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.LiteralNode;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts literals to constants of their inferred type. Strings become module constants.
 */
public final class LiteralNodeConverter implements IAstNodeToIrConverter<LiteralNode> {

    @Override
    public IrValue convert(LiteralNode node, IrGenContext ctx) {
        Type type = ctx.typeOf(node);
        switch (node.kind()) {
            case INTEGER:
                if (type.isFloat()) {
                    return IrConst.floating(node.integerValue().doubleValue(), type.irName());
                }
                return IrConst.integer(node.integerValue(), type.irName());
            case FLOAT:
                return IrConst.floating(((Number) node.value()).doubleValue(), type.irName());
            case STRING:
                return ctx.string((String) node.value());
            case CHAR:
                return IrConst.integer((Character) node.value(), "i32");
            default:
                return IrConst.bool((Boolean) node.value());
        }
    }
}
