package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.AssignNode;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.parser.ast.IndexNode;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrValue;

/**
 * Converts plain and compound assignments to a {@code var} or to an element of an array,
 * slice or pointer.
 */
public final class AssignNodeConverter implements IAstNodeToIrConverter<AssignNode> {

    @Override
    public IrValue convert(AssignNode node, IrGenContext ctx) {
        Type targetType = ctx.typeOf(node.target());
        IrValue address;
        if (node.target() instanceof IdentifierNode identifier) {
            Symbol symbol = ctx.typed().symbolOf(identifier)
                    .orElseThrow(() -> new InternalCompilerError("Unresolved assignment target", identifier.source()));
            IrGenContext.Binding binding = ctx.binding(symbol);
            if (!binding.slot()) {
                throw new InternalCompilerError("Assignment to immutable '" + symbol.name() + "'", node.source());
            }
            address = binding.value();
        } else if (node.target() instanceof IndexNode index) {
            address = IndexNodeConverter.address(index, ctx);
        } else {
            throw new InternalCompilerError("Invalid assignment target", node.source());
        }

        IrValue value = ctx.value(node.value());
        if (node.compound() != null) {
            IrValue current = ctx.load(address, targetType.irName(), node.source());
            value = BinaryNodeConverter.apply(node.compound(), current, value, targetType, node.source(), ctx);
        } else {
            value = ctx.coerce(value, ctx.typeOf(node.value()), targetType, node.source());
        }
        ctx.store(value, address, node.source());
        return null;
    }
}
