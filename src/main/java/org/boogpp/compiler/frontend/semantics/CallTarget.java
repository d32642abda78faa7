package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.config.ExternalFunction;
import org.boogpp.compiler.frontend.semantics.types.FunctionType;

/**
 * What a call site resolved to.
 *
 * @param kind          The kind of callee.
 * @param qualifiedName The callee's name after import resolution, e.g. {@code windows.process.inject_dll}.
 * @param signature     The callee's signature.
 * @param external      The ABI entry for {@link Kind#EXTERNAL} calls, otherwise null.
 */
public record CallTarget(Kind kind, String qualifiedName, FunctionType signature, ExternalFunction external) {

    public enum Kind {
        /** A function declared in the module. */
        FUNCTION,
        /** A runtime/OS function from the signature table. */
        EXTERNAL,
        /** A compiler built-in such as {@code len}. */
        BUILTIN
    }
}
