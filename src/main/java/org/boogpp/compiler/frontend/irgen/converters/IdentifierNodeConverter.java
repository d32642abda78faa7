package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.api.StatusCode;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrGlobalRef;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts a name to the value it denotes: a status constant, a function address, or the
 * current value of a local.
 */
public final class IdentifierNodeConverter implements IAstNodeToIrConverter<IdentifierNode> {

    @Override
    public IrValue convert(IdentifierNode node, IrGenContext ctx) {
        Symbol symbol = ctx.typed().symbolOf(node)
                .orElseThrow(() -> new InternalCompilerError("Unresolved identifier '" + node.name() + "'", node.source()));
        switch (symbol.kind()) {
            case CONSTANT:
                return IrConst.integer(StatusCode.valueOf(symbol.name()).value(), "i32");
            case FUNCTION:
                return new IrGlobalRef(symbol.name());
            default:
                IrGenContext.Binding binding = ctx.binding(symbol);
                return binding.slot() ? ctx.load(binding.value(), binding.type(), node.source()) : binding.value();
        }
    }
}
