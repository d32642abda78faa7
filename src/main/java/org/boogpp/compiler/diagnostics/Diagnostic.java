package org.boogpp.compiler.diagnostics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.frontend.CompilerPhase;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code identifying the kind of problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * @return The pipeline phase that produced this diagnostic.
     */
    public CompilerPhase stage() {
        return code.phase();
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s (%s)", type, fileName, lineNumber, columnNumber, message, code);
    }
}
