package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.diagnostics.CompilerLogger;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.TryChainNode;
import org.boogpp.compiler.frontend.parser.ast.TryClause;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.ResultType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code try_chain} to ordinary branches.
 * <p>
 * Clauses run in order: primary, each secondary, then the fallback. After a non-fallback
 * clause the status it produced is tested; anything but {@code SUCCESS} continues with the
 * next clause, success leaves the chain with that clause's value. The fallback runs only if
 * every clause before it failed and its value is taken unconditionally.
 * <p>
 * A clause signals failure through an {@code i32} status, a tuple or result whose first element
 * is the status, or a {@code bool} (false). A clause of any other type cannot fail, so the
 * clauses after it are not generated.
 */
public final class TryChainNodeConverter implements IAstNodeToIrConverter<TryChainNode> {

    @Override
    public IrValue convert(TryChainNode node, IrGenContext ctx) {
        Type chainType = ctx.typeOf(node);
        boolean producesValue = !chainType.isVoid();
        IrValue result = producesValue ? ctx.slot("try.result", chainType.irName(), node.source()) : null;
        String end = ctx.newLabel("try.end");

        List<TryClause> clauses = ordered(node);
        List<String> labels = new ArrayList<>();
        for (TryClause clause : clauses) {
            labels.add(ctx.newLabel("try." + clause.kind().name().toLowerCase()));
        }

        ctx.branch(labels.get(0), node.source());
        for (int i = 0; i < clauses.size(); i++) {
            TryClause clause = clauses.get(i);
            ctx.startBlock(labels.get(i));
            if (clause.body() != null) {
                ctx.statements(clause.body().statements());
            }
            IrValue value = clause.value() != null ? ctx.convert(clause.value()) : null;
            Type valueType = clause.value() != null ? ctx.typeOf(clause.value()) : Type.VOID;
            if (producesValue && value != null) {
                ctx.store(ctx.coerce(value, valueType, chainType, clause.source()), result, clause.source());
            }
            if (clause.kind() == TryClause.Kind.FALLBACK) {
                ctx.branch(end, clause.source());
                break;
            }
            IrValue failed = value == null ? null : failed(value, valueType, clause.source(), ctx);
            if (failed == null) {
                CompilerLogger.debug("try_chain clause at {} cannot fail; later clauses are dead", clause.source());
                ctx.branch(end, clause.source());
                break;
            }
            ctx.emit(new IrInstruction.CondBranch(failed, labels.get(i + 1), end, clause.source()));
        }

        ctx.startBlock(end);
        return producesValue ? ctx.load(result, chainType.irName(), node.source()) : null;
    }

    private static List<TryClause> ordered(TryChainNode node) {
        List<TryClause> clauses = new ArrayList<>();
        for (TryClause clause : node.clauses()) {
            if (clause.kind() != TryClause.Kind.FALLBACK) {
                clauses.add(clause);
            }
        }
        node.fallback().ifPresent(clauses::add);
        return clauses;
    }

    /**
     * @return An {@code i1} that is true if the clause failed, or null if the clause cannot fail.
     */
    private static IrValue failed(IrValue value, Type type, SourceInfo source, IrGenContext ctx) {
        if (type.isBool()) {
            return ctx.compare("icmp eq", value, IrConst.FALSE, source);
        }
        if (isStatus(type)) {
            return ctx.compare("icmp ne", value, IrConst.integer(0, "i32"), source);
        }
        boolean carriesStatus = type instanceof ResultType
                || (type instanceof TupleType tuple && isStatus(tuple.elements().get(0)));
        if (carriesStatus) {
            IrValue status = ctx.extract(value, 0, "i32", source);
            return ctx.compare("icmp ne", status, IrConst.integer(0, "i32"), source);
        }
        return null;
    }

    private static boolean isStatus(Type type) {
        return type.equals(PrimitiveType.STATUS);
    }
}
