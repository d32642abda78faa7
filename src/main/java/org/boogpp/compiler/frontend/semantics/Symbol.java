package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.semantics.types.Type;

/**
 * Represents a single named entity in the source code.
 *
 * @param name       The name of the symbol.
 * @param type       The static type of the symbol.
 * @param kind       What declared the symbol.
 * @param declaredAt The declaration site.
 */
public record Symbol(String name, Type type, Kind kind, SourceInfo declaredAt) {

    /**
     * Defines the different kinds of symbols.
     */
    public enum Kind {
        FUNCTION,
        CONSTANT,
        PARAMETER,
        LET,
        VAR,
        LOOP_VARIABLE
    }

    /**
     * @return true if the symbol may be the target of an assignment.
     */
    public boolean isMutable() {
        return kind == Kind.VAR;
    }
}
