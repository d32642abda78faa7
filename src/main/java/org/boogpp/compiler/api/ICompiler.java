package org.boogpp.compiler.api;

import org.boogpp.compiler.ir.IrModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the Boog++ compiler.
 */
public interface ICompiler {

    /**
     * Compiles one compilation unit.
     *
     * @param source  The complete source text.
     * @param options The invocation settings.
     * @return The IR module (if every stage succeeded) and all diagnostics.
     */
    CompilationResult compile(String source, CompilerOptions options);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles and returns the module, failing with an exception if there are errors.
     *
     * @param source  The complete source text.
     * @param options The invocation settings.
     * @return The generated IR module.
     * @throws CompilationException if any stage reported an error.
     */
    default IrModule compileOrThrow(String source, CompilerOptions options) throws CompilationException {
        CompilationResult result = compile(source, options);
        if (result.hasErrors() || result.module() == null) {
            throw new CompilationException(result.diagnostics());
        }
        return result.module();
    }

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @param options The invocation settings; the file name is taken from the path.
     * @return The compilation result.
     * @throws IOException if the file cannot be read.
     */
    default CompilationResult compile(Path programPath, CompilerOptions options) throws IOException {
        String source = Files.readString(programPath);
        return compile(source, new CompilerOptions(programPath.toString().replace('\\', '/'),
                options.safetyMode(), options.outputKind()));
    }
}
