package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.BinaryNode;
import org.boogpp.compiler.frontend.parser.ast.BinaryOperator;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

import java.util.List;

/**
 * Converts binary operators. {@code and}/{@code or} short-circuit through branches; string
 * concatenation and equality call the runtime; {@code **} goes through the {@code llvm.pow}
 * intrinsics.
 */
public final class BinaryNodeConverter implements IAstNodeToIrConverter<BinaryNode> {

    @Override
    public IrValue convert(BinaryNode node, IrGenContext ctx) {
        if (node.operator().category() == BinaryOperator.Category.LOGICAL) {
            return shortCircuit(node, ctx);
        }
        IrValue left = ctx.value(node.left());
        IrValue right = ctx.value(node.right());
        return apply(node.operator(), left, right, ctx.typeOf(node.left()), node.source(), ctx);
    }

    private static IrValue shortCircuit(BinaryNode node, IrGenContext ctx) {
        SourceInfo source = node.source();
        String rhs = ctx.newLabel(node.operator() == BinaryOperator.AND ? "and.rhs" : "or.rhs");
        String end = ctx.newLabel(node.operator() == BinaryOperator.AND ? "and.end" : "or.end");
        IrValue result = ctx.slot("logic", "i1", source);

        IrValue left = ctx.value(node.left());
        ctx.store(left, result, source);
        if (node.operator() == BinaryOperator.AND) {
            ctx.emit(new IrInstruction.CondBranch(left, rhs, end, source));
        } else {
            ctx.emit(new IrInstruction.CondBranch(left, end, rhs, source));
        }
        ctx.startBlock(rhs);
        ctx.store(ctx.value(node.right()), result, source);
        ctx.branch(end, source);
        ctx.startBlock(end);
        return ctx.load(result, "i1", source);
    }

    /**
     * Applies a non-logical operator to two values of the same type.
     * @param operator    The operator.
     * @param left        The left operand.
     * @param right       The right operand.
     * @param operandType The static type of both operands.
     * @return The result.
     */
    public static IrValue apply(BinaryOperator operator, IrValue left, IrValue right, Type operandType,
                                SourceInfo source, IrGenContext ctx) {
        if (operandType.isString()) {
            return applyToStrings(operator, left, right, source, ctx);
        }
        if (operator == BinaryOperator.POWER) {
            return power(left, right, operandType, source, ctx);
        }
        boolean floating = operandType.isFloat();
        boolean signed = isSigned(operandType);
        switch (operator.category()) {
            case EQUALITY:
            case RELATIONAL:
                return ctx.compare(floating ? "fcmp " + floatPredicate(operator) : "icmp " + intPredicate(operator, signed),
                        left, right, source);
            default:
                return ctx.binary(floating ? floatOpcode(operator) : intOpcode(operator, signed), left, right, source);
        }
    }

    private static IrValue applyToStrings(BinaryOperator operator, IrValue left, IrValue right, SourceInfo source,
                                          IrGenContext ctx) {
        if (operator == BinaryOperator.ADD) {
            return ctx.callExternal(ctx.runtime().stringConcat(), List.of("ptr", "ptr"), "ptr", List.of(left, right), source);
        }
        IrValue equal = ctx.callExternal(ctx.runtime().stringEquals(), List.of("ptr", "ptr"), "i1", List.of(left, right), source);
        return operator == BinaryOperator.NE ? ctx.binary("xor", equal, IrConst.TRUE, source) : equal;
    }

    private static IrValue power(IrValue left, IrValue right, Type operandType, SourceInfo source, IrGenContext ctx) {
        if (operandType.isFloat()) {
            String type = operandType.irName();
            String intrinsic = "llvm.pow." + ("float".equals(type) ? "f32" : "f64");
            return ctx.callExternal(intrinsic, List.of(type, type), type, List.of(left, right), source);
        }
        boolean signed = isSigned(operandType);
        String toFloat = signed ? "sitofp" : "uitofp";
        IrValue base = ctx.cast(toFloat, left, "double", source);
        IrValue exponent = ctx.cast(toFloat, right, "double", source);
        IrValue result = ctx.callExternal("llvm.pow.f64", List.of("double", "double"), "double",
                List.of(base, exponent), source);
        return ctx.cast(signed ? "fptosi" : "fptoui", result, operandType.irName(), source);
    }

    /**
     * @param type A type.
     * @return true for signed integers; comparisons of every other type use unsigned predicates.
     */
    public static boolean isSigned(Type type) {
        return type instanceof PrimitiveType primitive && primitive.kind().isInteger() && primitive.kind().isSigned();
    }

    private static String intOpcode(BinaryOperator operator, boolean signed) {
        return switch (operator) {
            case ADD -> "add";
            case SUB -> "sub";
            case MUL -> "mul";
            case DIV -> signed ? "sdiv" : "udiv";
            case MOD -> signed ? "srem" : "urem";
            case BIT_AND -> "and";
            case BIT_OR -> "or";
            case BIT_XOR -> "xor";
            case SHL -> "shl";
            case SHR -> signed ? "ashr" : "lshr";
            default -> throw new IllegalArgumentException("Not an integer operator: " + operator);
        };
    }

    private static String floatOpcode(BinaryOperator operator) {
        return switch (operator) {
            case ADD -> "fadd";
            case SUB -> "fsub";
            case MUL -> "fmul";
            case DIV -> "fdiv";
            case MOD -> "frem";
            default -> throw new IllegalArgumentException("Not a floating point operator: " + operator);
        };
    }

    private static String intPredicate(BinaryOperator operator, boolean signed) {
        String prefix = signed ? "s" : "u";
        return switch (operator) {
            case EQ -> "eq";
            case NE -> "ne";
            case LT -> prefix + "lt";
            case LE -> prefix + "le";
            case GT -> prefix + "gt";
            case GE -> prefix + "ge";
            default -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }

    private static String floatPredicate(BinaryOperator operator) {
        return switch (operator) {
            case EQ -> "oeq";
            case NE -> "one";
            case LT -> "olt";
            case LE -> "ole";
            case GT -> "ogt";
            case GE -> "oge";
            default -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }
}
