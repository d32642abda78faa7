package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds an array value element by element; elements are converted to the array's element type.
 */
public final class ArrayLiteralNodeConverter implements IAstNodeToIrConverter<ArrayLiteralNode> {

    @Override
    public IrValue convert(ArrayLiteralNode node, IrGenContext ctx) {
        ArrayType type = (ArrayType) ctx.typeOf(node);
        List<IrValue> elements = new ArrayList<>();
        for (ExpressionNode element : node.elements()) {
            elements.add(ctx.coerce(ctx.value(element), ctx.typeOf(element), type.element(), element.source()));
        }
        return ctx.aggregate(type.irName(), elements, node.source());
    }
}
