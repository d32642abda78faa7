package org.boogpp.compiler.ir;

import java.util.List;
import java.util.Optional;

/**
 * The IR of one compilation unit, consumed by an external backend.
 *
 * @param name      The module name.
 * @param externals The external declarations, each symbol once.
 * @param strings   The string constants.
 * @param functions The functions in source order.
 */
public record IrModule(String name, List<IrExternal> externals, List<IrStringConstant> strings, List<IrFunction> functions) {

    public IrModule {
        externals = List.copyOf(externals);
        strings = List.copyOf(strings);
        functions = List.copyOf(functions);
    }

    /**
     * @param name A function name.
     * @return The function with that name.
     */
    public Optional<IrFunction> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * @param symbol An ABI symbol.
     * @return The external declaration for it.
     */
    public Optional<IrExternal> external(String symbol) {
        return externals.stream().filter(e -> e.symbol().equals(symbol)).findFirst();
    }

    /**
     * @return A copy of this module in which every function keeps only its reachable blocks.
     */
    public IrModule withoutDeadBlocks() {
        return new IrModule(name, externals, strings, functions.stream().map(IrFunction::withoutDeadBlocks).toList());
    }
}
