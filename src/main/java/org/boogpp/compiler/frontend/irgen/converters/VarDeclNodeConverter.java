package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.VarDeclNode;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts {@code let} and {@code var} declarations. A {@code let} binds its value directly to
 * an SSA register; a {@code var} gets a stack slot accessed through load and store.
 */
public final class VarDeclNodeConverter implements IAstNodeToIrConverter<VarDeclNode> {

    @Override
    public IrValue convert(VarDeclNode node, IrGenContext ctx) {
        Symbol symbol = ctx.declaredBy(node);
        Type type = symbol.type();
        IrValue initial = node.initializer() == null
                ? ctx.zero(type)
                : ctx.coerce(ctx.value(node.initializer()), ctx.typeOf(node.initializer()), type, node.source());
        if (node.mutable()) {
            IrValue slot = ctx.slot(node.name(), type.irName(), node.source());
            ctx.store(initial, slot, node.source());
            ctx.bindSlot(symbol, slot, type.irName());
        } else {
            ctx.bind(symbol, initial);
        }
        return null;
    }
}
