package org.boogpp.compiler.api;

import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.ir.IrModule;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of one compilation: the IR module when every stage succeeded,
 * and all diagnostics reported along the way.
 *
 * @param module      The generated module, or null if any stage reported an error.
 * @param diagnostics All diagnostics, in reporting order.
 */
public record CompilationResult(IrModule module, List<Diagnostic> diagnostics) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The IR module if compilation succeeded.
     */
    public Optional<IrModule> moduleIfPresent() {
        return Optional.ofNullable(module);
    }

    /**
     * @return true if at least one diagnostic is an error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return Only the error diagnostics.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }
}
