package org.boogpp.compiler.diagnostics;

import org.boogpp.compiler.api.SourceInfo;

/**
 * Signals a broken contract between compiler phases, e.g. an IR block without a terminator
 * or an expression that reached the generator without a type. It is never a user error
 * and is therefore not reported through the {@link DiagnosticsEngine}.
 */
public class InternalCompilerError extends RuntimeException {

    /**
     * Constructs a new internal compiler error.
     * @param message The description of the violated invariant.
     */
    public InternalCompilerError(String message) {
        super(message);
    }

    /**
     * Constructs a new internal compiler error pinned to a source location.
     * @param message The description of the violated invariant.
     * @param source The location being compiled when the violation was detected.
     */
    public InternalCompilerError(String message, SourceInfo source) {
        super(String.format("%s at %s", message, source));
    }
}
