package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.ReturnNode;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@code return}. Several values of a multi-return function are packed into one
 * struct of the declared return types.
 */
public final class ReturnNodeConverter implements IAstNodeToIrConverter<ReturnNode> {

    @Override
    public IrValue convert(ReturnNode node, IrGenContext ctx) {
        List<Type> declared = ctx.returnTypes();
        List<ExpressionNode> values = node.values();
        IrValue result;
        if (declared.isEmpty()) {
            for (ExpressionNode value : values) {
                ctx.convert(value);
            }
            result = null;
        } else if (values.size() == 1) {
            Type target = Type.ofReturns(declared);
            result = ctx.coerce(ctx.value(values.get(0)), ctx.typeOf(values.get(0)), target, node.source());
        } else {
            List<IrValue> elements = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                ExpressionNode value = values.get(i);
                elements.add(ctx.coerce(ctx.value(value), ctx.typeOf(value), declared.get(i), value.source()));
            }
            result = ctx.aggregate(new TupleType(declared).irName(), elements, node.source());
        }
        ctx.emit(new IrInstruction.Return(result, node.source()));
        return null;
    }
}
