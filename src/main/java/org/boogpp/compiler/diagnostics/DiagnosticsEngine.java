package org.boogpp.compiler.diagnostics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.CompilerPhase;
import org.boogpp.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the errors, warnings and notes of one compilation in report order. Every stage
 * reports here instead of throwing, so a single run can surface problems from several stages.
 * <p>
 * One instance belongs to exactly one compilation and is not thread-safe.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code         The error code.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports an error positioned at the given token.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param at      The token the error refers to.
     */
    public void reportError(CompilerErrorCode code, String message, Token at) {
        reportError(code, message, at.fileName(), at.line(), at.column());
    }

    /**
     * Reports an error positioned at the given source location.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param at      The source location.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo at) {
        reportError(code, message, at.fileName(), at.lineNumber(), at.columnNumber());
    }

    /**
     * Reports a warning.
     *
     * @param code    The code identifying the kind of warning.
     * @param message The warning message.
     * @param at      The source location.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceInfo at) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, at.fileName(), at.lineNumber(), at.columnNumber()));
    }

    /**
     * Reports an informational message.
     *
     * @param code    The code identifying the kind of message.
     * @param message The message.
     * @param at      The source location.
     */
    public void reportInfo(CompilerErrorCode code, String message, SourceInfo at) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, code, message, at.fileName(), at.lineNumber(), at.columnNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Checks if errors have been reported by the given phase.
     *
     * @param phase The phase to look at.
     * @return {@code true} if that phase reported at least one error.
     */
    public boolean hasErrors(CompilerPhase phase) {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR && d.stage() == phase);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns only the errors, in reporting order.
     *
     * @return The error diagnostics.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }
}
