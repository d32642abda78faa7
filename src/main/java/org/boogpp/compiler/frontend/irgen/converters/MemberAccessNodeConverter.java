package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.MemberAccessNode;
import org.boogpp.compiler.ir.IrValue;

/**
 * {@code .status} and {@code .value} of a result or a {@code (status, T)} tuple.
 */
public final class MemberAccessNodeConverter implements IAstNodeToIrConverter<MemberAccessNode> {

    @Override
    public IrValue convert(MemberAccessNode node, IrGenContext ctx) {
        IrValue aggregate = ctx.value(node.target());
        if ("status".equals(node.member())) {
            return ctx.extract(aggregate, 0, "i32", node.source());
        }
        return ctx.extract(aggregate, 1, ctx.typeOf(node).irName(), node.source());
    }
}
