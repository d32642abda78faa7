package org.boogpp.compiler.ir;

import java.util.List;

/**
 * A function declared but not defined in the module, resolved against the runtime/OS ABI at
 * link time.
 *
 * @param symbol         The ABI symbol.
 * @param parameterTypes The IR parameter types.
 * @param returnType     The IR return type, {@code void} for none.
 */
public record IrExternal(String symbol, List<String> parameterTypes, String returnType) {

    public IrExternal {
        parameterTypes = List.copyOf(parameterTypes);
    }
}
