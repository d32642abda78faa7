package org.boogpp.compiler.api;

import org.boogpp.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link ICompiler#compileOrThrow} when a compilation reported errors. The message
 * lists the errors, one per line; warnings and notes are only available from
 * {@link #getDiagnostics()}.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param diagnostics Every diagnostic of the failed compilation, in report order.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * @return All diagnostics of the failed compilation, including warnings and notes.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The first error reported, which is usually the root cause.
     */
    public Diagnostic getFirstError() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .findFirst()
                .orElseThrow();
    }
}
