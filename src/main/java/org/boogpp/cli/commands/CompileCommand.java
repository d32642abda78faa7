package org.boogpp.cli.commands;

import org.boogpp.compiler.api.CompilationResult;
import org.boogpp.compiler.api.ICompiler;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.ir.IrPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.function.Function;

@Command(name = "compile", aliases = "build", description = "Compiles a Boog++ source file to textual IR.")
public class CompileCommand extends AbstractSourceCommand {

    @Option(names = {"-o", "--output"}, description = "Write the IR to this file instead of stdout.")
    private File output;

    public CompileCommand() {
        super();
    }

    /**
     * @param compilerFactory Creates the compiler for the loaded configuration.
     */
    public CompileCommand(Function<CompilerConfig, ICompiler> compilerFactory) {
        super(compilerFactory);
    }

    @Override
    int handle(CompilationResult result) throws IOException {
        String ir = result.moduleIfPresent().map(IrPrinter::print).orElse(null);
        if (ir != null && output != null) {
            write(output, ir);
        }
        report(result, output == null ? ir : null);
        if (ir == null) {
            return EXIT_COMPILATION_ERRORS;
        }
        if (output == null && !json) {
            spec.commandLine().getOut().print(ir);
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
