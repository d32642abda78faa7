package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.ForNode;
import org.boogpp.compiler.frontend.semantics.CallTarget;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrReg;
import org.boogpp.compiler.ir.IrValue;

import java.util.List;
import java.util.function.Consumer;

/**
 * Desugars {@code for} loops to counted {@code while} loops.
 * <p>
 * {@code for i in range(a, b)} counts an {@code i32} from {@code a} (0 if omitted) up to but
 * excluding {@code b}; the bound is evaluated once. Iterating an array or a slice counts an
 * {@code i64} index up to the length and binds each element in turn.
 */
public final class ForNodeConverter implements IAstNodeToIrConverter<ForNode> {

    @Override
    public IrValue convert(ForNode node, IrGenContext ctx) {
        Symbol variable = ctx.declaredBy(node);
        boolean range = node.iterable() instanceof CallNode call
                && ctx.typed().callTarget(call).map(t -> t.kind() == CallTarget.Kind.BUILTIN).orElse(false);
        if (range) {
            convertRange(node, (CallNode) node.iterable(), variable, ctx);
        } else {
            convertSequence(node, variable, ctx);
        }
        return null;
    }

    private static void convertRange(ForNode node, CallNode call, Symbol variable, IrGenContext ctx) {
        SourceInfo source = node.source();
        List<ExpressionNode> arguments = call.arguments();
        IrValue start = arguments.size() == 2 ? ctx.value(arguments.get(0)) : IrConst.integer(0, "i32");
        IrValue limit = ctx.value(arguments.get(arguments.size() - 1));
        IrReg counter = ctx.slot(node.variable(), "i32", source);
        ctx.store(start, counter, source);

        loop(node, counter, "i32", limit, "icmp slt", ctx, current -> ctx.bind(variable, current));
    }

    private static void convertSequence(ForNode node, Symbol variable, IrGenContext ctx) {
        SourceInfo source = node.source();
        Type iterableType = ctx.typeOf(node.iterable());
        IrValue iterable = ctx.value(node.iterable());
        Type element;
        IrValue base;
        IrValue length;
        if (iterableType instanceof ArrayType array) {
            element = array.element();
            base = ctx.spill(iterable, source);
            length = IrConst.integer(array.size(), "i64");
        } else {
            element = ((SliceType) iterableType).element();
            base = ctx.extract(iterable, 0, "ptr", source);
            length = ctx.extract(iterable, 1, "i64", source);
        }
        IrReg index = ctx.slot("for.index", "i64", source);
        ctx.store(IrConst.integer(0, "i64"), index, source);

        String elementType = element.irName();
        loop(node, index, "i64", length, "icmp slt", ctx, current -> {
            IrReg address = ctx.newRegister("ptr");
            ctx.emit(new IrInstruction.ElementPtr(address, elementType, base, current, source));
            ctx.bind(variable, ctx.load(address, elementType, source));
        });
    }

    /**
     * Emits header, body, step and exit blocks around a counter held in {@code counter}.
     */
    private static void loop(ForNode node, IrReg counter, String counterType, IrValue limit, String predicate,
                             IrGenContext ctx, Consumer<IrValue> bindCurrent) {
        SourceInfo source = node.source();
        String header = ctx.newLabel("for.cond");
        String body = ctx.newLabel("for.body");
        String step = ctx.newLabel("for.step");
        String end = ctx.newLabel("for.end");

        ctx.startBlock(header);
        IrValue current = ctx.load(counter, counterType, source);
        IrValue inBounds = ctx.compare(predicate, current, limit, source);
        ctx.emit(new IrInstruction.CondBranch(inBounds, body, end, source));

        ctx.startBlock(body);
        bindCurrent.accept(ctx.load(counter, counterType, source));
        ctx.pushLoop(end, step);
        ctx.statements(node.body().statements());
        ctx.popLoop();
        ctx.branch(step, source);

        ctx.startBlock(step);
        IrValue value = ctx.load(counter, counterType, source);
        ctx.store(ctx.binary("add", value, IrConst.integer(1, counterType), source), counter, source);
        ctx.emit(new IrInstruction.Branch(header, source));

        ctx.startBlock(end);
    }
}
