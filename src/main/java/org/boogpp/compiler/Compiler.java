package org.boogpp.compiler;

import org.boogpp.compiler.api.CompilationResult;
import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.CompilerOptions;
import org.boogpp.compiler.api.ICompiler;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.diagnostics.CompilerLogger;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.CompilerPhase;
import org.boogpp.compiler.frontend.irgen.IrConverterRegistry;
import org.boogpp.compiler.frontend.irgen.IrGenerator;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.lexer.Token;
import org.boogpp.compiler.frontend.parser.DecoratorKind;
import org.boogpp.compiler.frontend.parser.Parser;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.safety.SafeModule;
import org.boogpp.compiler.frontend.safety.SafetyChecker;
import org.boogpp.compiler.frontend.semantics.TypeChecker;
import org.boogpp.compiler.frontend.semantics.TypedModule;
import org.boogpp.compiler.ir.IrModule;
import org.boogpp.compiler.ir.IrPrinter;
import org.boogpp.compiler.ir.IrVerifier;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text to
 * an IR module: lexing, parsing, type checking, safety checking, code generation and
 * verification.
 * <p>
 * Every call to {@link #compile(String, CompilerOptions)} owns its own diagnostics, tokens,
 * AST, symbol tables and IR. The configuration tables are immutable, so one instance may
 * serve concurrent compilations.
 */
public class Compiler implements ICompiler {

    private final CompilerConfig config;
    private final IrConverterRegistry registry = IrConverterRegistry.initializeWithDefaults();
    private volatile int verbosity = -1;

    /**
     * Creates a compiler using the layered configuration of {@link CompilerConfig#load()}.
     */
    public Compiler() {
        this(CompilerConfig.load());
    }

    /**
     * @param config The signature, classification and runtime tables to compile against.
     */
    public Compiler(CompilerConfig config) {
        this.config = config;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Later stages are skipped entirely if parsing yields nothing usable. Code generation runs
     * only if the front-end stages reported no errors.
     *
     * @throws org.boogpp.compiler.diagnostics.InternalCompilerError if the generator or the IR
     *         verifier detect a broken invariant.
     */
    @Override
    public CompilationResult compile(String source, CompilerOptions options) {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, options.fileName()).scanTokens();
        CompilerLogger.stage(CompilerPhase.LEXING, "{}: {} tokens, {} diagnostics", options.fileName(), tokens.size(),
                diagnostics.getDiagnostics().size());

        // Phase 2: Parsing
        ModuleNode module = new Parser(tokens, diagnostics).parse();
        CompilerLogger.stage(CompilerPhase.PARSING, "{}: {} functions, {} imports, {} diagnostics", options.fileName(),
                module.functions().size(), module.imports().size(), diagnostics.getDiagnostics().size());
        if (module.isEmpty() && diagnostics.hasErrors()) {
            return new CompilationResult(null, diagnostics.getDiagnostics());
        }

        // Phase 3: Type Checking
        TypedModule typed = new TypeChecker(diagnostics, config.externals(), config.runtime()).check(module);
        CompilerLogger.stage(CompilerPhase.TYPE_CHECKING, "{}: {} diagnostics", options.fileName(),
                diagnostics.getDiagnostics().size());

        // Phase 4: Safety Checking
        SafeModule safe = new SafetyChecker(diagnostics, config.classifications()).check(typed, options.safetyMode());
        CompilerLogger.stage(CompilerPhase.SAFETY_CHECKING, "{}: mode {}, {} audited operations, {} diagnostics",
                options.fileName(), safe.moduleMode(), safe.audited().size(), diagnostics.getDiagnostics().size());

        checkEntryPoint(module, options, diagnostics);
        if (diagnostics.hasErrors()) {
            return new CompilationResult(null, diagnostics.getDiagnostics());
        }

        // Phase 5: Code Generation
        IrGenerator generator = new IrGenerator(diagnostics, registry, config.runtime());
        IrModule ir = generator.generate(safe, moduleName(module, options));
        List<String> dead = new IrVerifier(diagnostics).verify(ir);
        CompilerLogger.stage(CompilerPhase.CODE_GENERATION, "{}: {} functions, {} externals, {} dead blocks",
                options.fileName(), ir.functions().size(), ir.externals().size(), dead.size());
        if (CompilerLogger.getLevel() >= CompilerLogger.TRACE) {
            CompilerLogger.trace("Generated IR:\n{}", IrPrinter.print(ir));
        }
        if (diagnostics.hasErrors()) {
            return new CompilationResult(null, diagnostics.getDiagnostics());
        }
        return new CompilationResult(ir.withoutDeadBlocks(), diagnostics.getDiagnostics());
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    private static void checkEntryPoint(ModuleNode module, CompilerOptions options, DiagnosticsEngine diagnostics) {
        switch (options.outputKind()) {
            case EXE:
                if (module.functions().stream().noneMatch(f -> f.name().equals("main"))) {
                    diagnostics.reportError(CompilerErrorCode.MISSING_ENTRY_POINT,
                            "An executable needs a function 'main'.", module.source());
                }
                break;
            case DRIVER:
                List<FunctionDeclNode> entries = module.functions().stream()
                        .filter(f -> f.hasDecorator(DecoratorKind.DRIVER_ENTRY))
                        .toList();
                if (entries.size() != 1) {
                    diagnostics.reportError(CompilerErrorCode.MISSING_ENTRY_POINT,
                            "A driver needs exactly one @driver_entry function but has " + entries.size() + ".",
                            entries.isEmpty() ? module.source() : entries.get(1).source());
                }
                break;
            default:
                break;
        }
    }

    private static String moduleName(ModuleNode module, CompilerOptions options) {
        if (module.name() != null) {
            return module.name();
        }
        String fileName = options.fileName();
        String base = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
