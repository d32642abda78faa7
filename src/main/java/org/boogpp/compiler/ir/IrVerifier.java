package org.boogpp.compiler.ir;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.CompilerLogger;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.diagnostics.InternalCompilerError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a generated module, run before it leaves the compiler.
 * <p>
 * A violated block structure (missing or misplaced terminator, unknown branch target, register
 * defined twice or never, return of the wrong type) means the generator is broken and raises
 * {@link InternalCompilerError}. A call to an external that is undeclared or declared with a
 * different signature is reported as {@link CompilerErrorCode#UNKNOWN_EXTERNAL}. Blocks no path
 * from the entry reaches are dead code, which is reported but is not an error.
 */
public class IrVerifier {

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics The engine receiving {@code UNKNOWN_EXTERNAL} errors.
     */
    public IrVerifier(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Verifies a module.
     * @param module The module.
     * @return The dead blocks, as {@code function:label}.
     * @throws InternalCompilerError if the block structure is malformed.
     */
    public List<String> verify(IrModule module) {
        Map<String, IrExternal> externals = new HashMap<>();
        for (IrExternal external : module.externals()) {
            if (externals.put(external.symbol(), external) != null) {
                throw new InternalCompilerError("External '" + external.symbol() + "' is declared twice");
            }
        }
        Map<String, IrFunction> functions = new HashMap<>();
        for (IrFunction function : module.functions()) {
            if (functions.put(function.name(), function) != null) {
                throw new InternalCompilerError("Function '" + function.name() + "' is defined twice", function.source());
            }
        }

        List<String> dead = new ArrayList<>();
        for (IrFunction function : module.functions()) {
            verifyFunction(function, functions, externals);
            Set<String> reachable = function.reachableLabels();
            for (IrBlock block : function.blocks()) {
                if (!reachable.contains(block.label())) {
                    dead.add(function.name() + ":" + block.label());
                }
            }
        }
        if (!dead.isEmpty()) {
            CompilerLogger.debug("Dead blocks: {}", dead);
        }
        return dead;
    }

    private void verifyFunction(IrFunction function, Map<String, IrFunction> functions, Map<String, IrExternal> externals) {
        if (function.blocks().isEmpty()) {
            throw new InternalCompilerError("Function '" + function.name() + "' has no blocks", function.source());
        }
        Set<String> labels = new HashSet<>();
        for (IrBlock block : function.blocks()) {
            if (!labels.add(block.label())) {
                throw new InternalCompilerError("Label '" + block.label() + "' is used twice in '" + function.name() + "'");
            }
        }

        Set<String> defined = new HashSet<>();
        for (IrReg parameter : function.parameters()) {
            define(defined, parameter, function);
        }
        for (IrBlock block : function.blocks()) {
            for (IrInstruction instruction : block.instructions()) {
                instruction.defines().ifPresent(reg -> define(defined, reg, function));
            }
        }

        for (IrBlock block : function.blocks()) {
            List<IrInstruction> instructions = block.instructions();
            if (block.terminator().isEmpty()) {
                throw new InternalCompilerError("Block '" + block.label() + "' of '" + function.name() + "' has no terminator");
            }
            for (int i = 0; i < instructions.size(); i++) {
                IrInstruction instruction = instructions.get(i);
                if (instruction.isTerminator() && i != instructions.size() - 1) {
                    throw new InternalCompilerError("Terminator in the middle of block '" + block.label() + "'",
                            instruction.source());
                }
                for (IrValue used : instruction.uses()) {
                    if (used instanceof IrReg reg && !defined.contains(reg.name())) {
                        throw new InternalCompilerError("Register %" + reg.name() + " is used but never defined",
                                instruction.source());
                    }
                }
                for (String target : instruction.successors()) {
                    if (!labels.contains(target)) {
                        throw new InternalCompilerError("Branch to unknown block '" + target + "'", instruction.source());
                    }
                }
                if (instruction instanceof IrInstruction.Return ret) {
                    verifyReturn(function, ret);
                } else if (instruction instanceof IrInstruction.Call call) {
                    verifyCall(call, functions, externals);
                }
            }
        }
    }

    private static void define(Set<String> defined, IrReg reg, IrFunction function) {
        if (!defined.add(reg.name())) {
            throw new InternalCompilerError("Register %" + reg.name() + " is defined twice in '" + function.name() + "'",
                    function.source());
        }
    }

    private static void verifyReturn(IrFunction function, IrInstruction.Return ret) {
        String actual = ret.value() == null ? "void" : ret.value().type();
        if (!actual.equals(function.returnType())) {
            throw new InternalCompilerError("Function '" + function.name() + "' returns " + function.returnType()
                    + " but a return yields " + actual, ret.source());
        }
    }

    private void verifyCall(IrInstruction.Call call, Map<String, IrFunction> functions, Map<String, IrExternal> externals) {
        List<String> argumentTypes = call.arguments().stream().map(IrValue::type).toList();
        IrFunction function = functions.get(call.callee());
        if (function != null) {
            if (!function.parameterTypes().equals(argumentTypes) || !function.returnType().equals(call.returnType())) {
                throw new InternalCompilerError("Call of '" + call.callee() + "' does not match its definition", call.source());
            }
            return;
        }
        IrExternal external = externals.get(call.callee());
        if (external == null) {
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_EXTERNAL,
                    "Call of undeclared external symbol '" + call.callee() + "'.", call.source());
            return;
        }
        if (!external.parameterTypes().equals(argumentTypes) || !external.returnType().equals(call.returnType())) {
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_EXTERNAL,
                    "Call of '" + call.callee() + "' with (" + String.join(", ", argumentTypes) + ") -> " + call.returnType()
                            + " does not match its declaration (" + String.join(", ", external.parameterTypes()) + ") -> "
                            + external.returnType() + ".", call.source());
        }
    }
}
