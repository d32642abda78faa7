package org.boogpp.compiler.config;

import org.boogpp.compiler.frontend.semantics.types.FunctionType;
import org.boogpp.compiler.frontend.semantics.types.Type;

import java.util.List;

/**
 * One entry of the runtime/OS ABI: a function the generated code may call but that is
 * defined outside the compilation unit.
 *
 * @param name       The source-level qualified name, e.g. {@code windows.registry.write}.
 * @param symbol     The ABI symbol the call is emitted against, e.g. {@code bpp_registry_write}.
 * @param parameters The parameter types.
 * @param returnType The return type; {@link Type#VOID} for none.
 */
public record ExternalFunction(String name, String symbol, List<Type> parameters, Type returnType) {

    public ExternalFunction {
        parameters = List.copyOf(parameters);
    }

    /**
     * @return The module part of the name ({@code windows.registry}), or empty for a top-level built-in.
     */
    public String modulePath() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    /**
     * @return The signature as a function type.
     */
    public FunctionType signature() {
        return new FunctionType(parameters, returnType.isVoid() ? List.of() : List.of(returnType));
    }
}
