package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.config.RuntimeSymbols;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.safety.SafeModule;
import org.boogpp.compiler.ir.IrModule;

/**
 * Phase: Generates IR from a checked module by delegating each function to the converter
 * resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

    private final DiagnosticsEngine diagnostics;
    private final IrConverterRegistry registry;
    private final RuntimeSymbols runtime;

    /**
     * Creates a new IR generator with a diagnostics engine and a prepared registry.
     *
     * @param diagnostics The diagnostics engine for reporting issues.
     * @param registry    The converter registry.
     * @param runtime     The runtime hooks generated code calls.
     */
    public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry, RuntimeSymbols runtime) {
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.runtime = runtime;
    }

    /**
     * Generates one IR function per source function.
     *
     * @param module     The type- and safety-checked module.
     * @param moduleName The name of the IR module.
     * @return The generated module, dead blocks included.
     */
    public IrModule generate(SafeModule module, String moduleName) {
        IrGenContext ctx = new IrGenContext(moduleName, diagnostics, registry, module, runtime);
        for (FunctionDeclNode function : module.typed().module().functions()) {
            ctx.convert(function);
        }
        return ctx.build();
    }
}
