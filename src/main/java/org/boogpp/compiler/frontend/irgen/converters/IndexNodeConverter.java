package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.parser.ast.IndexNode;
import org.boogpp.compiler.frontend.parser.ast.LiteralNode;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrReg;
import org.boogpp.compiler.ir.IrValue;

import java.util.Optional;

/**
 * Converts element reads. Tuples are indexed by constant field number; arrays, slices and
 * pointers go through an element address.
 */
public final class IndexNodeConverter implements IAstNodeToIrConverter<IndexNode> {

    @Override
    public IrValue convert(IndexNode node, IrGenContext ctx) {
        Type targetType = ctx.typeOf(node.target());
        String elementType = ctx.typeOf(node).irName();
        if (targetType instanceof TupleType) {
            int field = ((LiteralNode) node.index()).integerValue().intValue();
            return ctx.extract(ctx.value(node.target()), field, elementType, node.source());
        }
        return ctx.load(address(node, ctx), elementType, node.source());
    }

    /**
     * Computes the address of an array, slice or pointer element.
     * <p>
     * Array and slice indices that are not integer literals are checked against the length at
     * run time; literal array indices were checked during type checking. Pointer indexing is
     * never checked, but is audit-logged if the safety checker asked for it.
     *
     * @param node The index expression.
     * @param ctx  The generation context.
     * @return The element address.
     */
    public static IrValue address(IndexNode node, IrGenContext ctx) {
        Type targetType = ctx.typeOf(node.target());
        Type elementType = ctx.typeOf(node);
        IrValue base;
        IrValue length = null;
        if (targetType instanceof ArrayType array) {
            base = storage(node.target(), ctx).orElseGet(() -> ctx.spill(ctx.value(node.target()), node.source()));
            length = IrConst.integer(array.size(), "i64");
        } else if (targetType instanceof SliceType) {
            IrValue slice = ctx.value(node.target());
            base = ctx.extract(slice, 0, "ptr", node.source());
            length = ctx.extract(slice, 1, "i64", node.source());
        } else {
            base = ctx.value(node.target());
        }

        IrValue index = ctx.toI64(ctx.value(node.index()), ctx.typeOf(node.index()), node.source());
        boolean constant = node.index() instanceof LiteralNode;
        if (length != null && !constant) {
            ctx.boundsCheck(index, length, node.source());
        }
        ctx.safe().auditedOperation(node).ifPresent(operation -> ctx.audit(operation, node.source()));

        IrReg result = ctx.newRegister("ptr");
        ctx.emit(new IrInstruction.ElementPtr(result, elementType.irName(), base, index, node.source()));
        return result;
    }

    /**
     * Finds the memory an array value already lives in: the slot of a {@code var}, or the element
     * address of an enclosing array, slice or pointer. Writes through it reach the original.
     */
    private static Optional<IrValue> storage(ExpressionNode target, IrGenContext ctx) {
        if (target instanceof IndexNode outer && !(ctx.typeOf(outer.target()) instanceof TupleType)) {
            return Optional.of(address(outer, ctx));
        }
        if (!(target instanceof IdentifierNode identifier)) {
            return Optional.empty();
        }
        Optional<Symbol> symbol = ctx.typed().symbolOf(identifier);
        if (symbol.isEmpty() || symbol.get().kind() == Symbol.Kind.FUNCTION || symbol.get().kind() == Symbol.Kind.CONSTANT) {
            return Optional.empty();
        }
        IrGenContext.Binding binding = ctx.binding(symbol.get());
        return binding.slot() ? Optional.of(binding.value()) : Optional.empty();
    }
}
