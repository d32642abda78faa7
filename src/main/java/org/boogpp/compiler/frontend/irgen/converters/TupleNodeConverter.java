package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.TupleNode;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

public final class TupleNodeConverter implements IAstNodeToIrConverter<TupleNode> {

    @Override
    public IrValue convert(TupleNode node, IrGenContext ctx) {
        List<IrValue> elements = new ArrayList<>();
        for (ExpressionNode element : node.elements()) {
            elements.add(ctx.value(element));
        }
        return ctx.aggregate(ctx.typeOf(node).irName(), elements, node.source());
    }
}
