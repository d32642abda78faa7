package org.boogpp.compiler.ir;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Renders a module as LLVM-flavoured IR text.
 */
public final class IrPrinter {

    private IrPrinter() {}

    /**
     * @param module The module.
     * @return The module as text, one instruction per line.
     */
    public static String print(IrModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(module.name()).append("'\n");

        if (!module.strings().isEmpty()) {
            sb.append('\n');
            for (IrStringConstant constant : module.strings()) {
                byte[] bytes = constant.value().getBytes(StandardCharsets.UTF_8);
                sb.append('@').append(constant.name())
                        .append(" = private unnamed_addr constant [").append(bytes.length + 1).append(" x i8] c\"")
                        .append(escape(bytes)).append("\\00\"\n");
            }
        }
        if (!module.externals().isEmpty()) {
            sb.append('\n');
            for (IrExternal external : module.externals()) {
                sb.append("declare ").append(external.returnType()).append(" @").append(external.symbol())
                        .append('(').append(String.join(", ", external.parameterTypes())).append(")\n");
            }
        }
        for (IrFunction function : module.functions()) {
            sb.append('\n');
            print(function, sb);
        }
        return sb.toString();
    }

    private static void print(IrFunction function, StringBuilder sb) {
        for (String annotation : function.annotations()) {
            sb.append("; ").append(annotation).append('\n');
        }
        String parameters = function.parameters().stream()
                .map(p -> p.type() + " " + p.render())
                .collect(Collectors.joining(", "));
        sb.append("define ").append(function.returnType()).append(" @").append(function.name())
                .append('(').append(parameters).append(") {\n");
        for (IrBlock block : function.blocks()) {
            sb.append(block.label()).append(":\n");
            for (IrInstruction instruction : block.instructions()) {
                sb.append("  ").append(print(instruction)).append('\n');
            }
        }
        sb.append("}\n");
    }

    /**
     * @param instruction An instruction.
     * @return The instruction as one line of text, without indentation.
     */
    public static String print(IrInstruction instruction) {
        if (instruction instanceof IrInstruction.Binary i) {
            return assign(i.result()) + i.opcode() + " " + i.left().type() + " " + i.left().render() + ", " + i.right().render();
        }
        if (instruction instanceof IrInstruction.Compare i) {
            return assign(i.result()) + i.opcode() + " " + i.left().type() + " " + i.left().render() + ", " + i.right().render();
        }
        if (instruction instanceof IrInstruction.Cast i) {
            return assign(i.result()) + i.opcode() + " " + typed(i.value()) + " to " + i.result().type();
        }
        if (instruction instanceof IrInstruction.Call i) {
            String arguments = i.arguments().stream().map(IrPrinter::typed).collect(Collectors.joining(", "));
            String call = "call " + i.returnType() + " @" + i.callee() + "(" + arguments + ")";
            return i.result() == null ? call : assign(i.result()) + call;
        }
        if (instruction instanceof IrInstruction.Alloca i) {
            return assign(i.result()) + "alloca " + i.allocatedType();
        }
        if (instruction instanceof IrInstruction.Load i) {
            return assign(i.result()) + "load " + i.result().type() + ", " + typed(i.address());
        }
        if (instruction instanceof IrInstruction.Store i) {
            return "store " + typed(i.value()) + ", " + typed(i.address());
        }
        if (instruction instanceof IrInstruction.ExtractValue i) {
            return assign(i.result()) + "extractvalue " + typed(i.aggregate()) + ", " + i.index();
        }
        if (instruction instanceof IrInstruction.InsertValue i) {
            return assign(i.result()) + "insertvalue " + typed(i.aggregate()) + ", " + typed(i.element()) + ", " + i.index();
        }
        if (instruction instanceof IrInstruction.ElementPtr i) {
            return assign(i.result()) + "getelementptr " + i.elementType() + ", " + typed(i.base()) + ", " + typed(i.index());
        }
        if (instruction instanceof IrInstruction.Branch i) {
            return "br label %" + i.target();
        }
        if (instruction instanceof IrInstruction.CondBranch i) {
            return "br " + typed(i.condition()) + ", label %" + i.ifTrue() + ", label %" + i.ifFalse();
        }
        if (instruction instanceof IrInstruction.Return i) {
            return i.value() == null ? "ret void" : "ret " + typed(i.value());
        }
        return "unreachable";
    }

    private static String assign(IrReg result) {
        return result.render() + " = ";
    }

    private static String typed(IrValue value) {
        return value.type() + " " + value.render();
    }

    private static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append(String.format("\\%02X", c));
            }
        }
        return sb.toString();
    }
}
