package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.config.ExternalFunction;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.semantics.CallTarget;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts calls of module functions, of externals and of {@code len}.
 * <p>
 * An external call declares its symbol in the module. If the safety checker marked the call
 * for audit logging, the audit hook runs after the arguments are evaluated and before the call.
 */
public final class CallNodeConverter implements IAstNodeToIrConverter<CallNode> {

    @Override
    public IrValue convert(CallNode node, IrGenContext ctx) {
        CallTarget target = ctx.typed().callTarget(node)
                .orElseThrow(() -> new InternalCompilerError("Unresolved call", node.source()));
        switch (target.kind()) {
            case FUNCTION: {
                List<IrValue> arguments = arguments(node, target.signature().parameters(), ctx);
                return ctx.call(target.qualifiedName(), target.signature().returnType().irName(), arguments, node.source());
            }
            case EXTERNAL:
                return callExternal(node, target.external(), ctx);
            default:
                return length(node, ctx);
        }
    }

    private static IrValue callExternal(CallNode node, ExternalFunction external, IrGenContext ctx) {
        List<IrValue> arguments = arguments(node, external.parameters(), ctx);
        ctx.safe().auditedOperation(node).ifPresent(operation -> ctx.audit(operation, node.source()));
        List<String> parameterTypes = external.parameters().stream().map(Type::irName).toList();
        return ctx.callExternal(external.symbol(), parameterTypes, external.returnType().irName(), arguments, node.source());
    }

    private static List<IrValue> arguments(CallNode node, List<Type> parameters, IrGenContext ctx) {
        List<IrValue> arguments = new ArrayList<>();
        for (int i = 0; i < node.arguments().size(); i++) {
            ExpressionNode argument = node.arguments().get(i);
            arguments.add(ctx.coerce(ctx.value(argument), ctx.typeOf(argument), parameters.get(i), argument.source()));
        }
        return arguments;
    }

    private static IrValue length(CallNode node, IrGenContext ctx) {
        ExpressionNode argument = node.arguments().get(0);
        Type type = ctx.typeOf(argument);
        if (type instanceof ArrayType array) {
            return IrConst.integer(array.size(), "i64");
        }
        IrValue value = ctx.value(argument);
        if (type instanceof SliceType) {
            return ctx.extract(value, 1, "i64", node.source());
        }
        return ctx.callExternal(ctx.runtime().stringLength(), List.of("ptr"), "i64", List.of(value), node.source());
    }
}
