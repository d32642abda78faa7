package org.boogpp.compiler.ir;

/**
 * An operand of an IR instruction: a virtual register, a constant or a module-level global.
 */
public sealed interface IrValue permits IrReg, IrConst, IrGlobalRef {

    /**
     * @return The IR type of the value, e.g. {@code i32} or {@code { i32, ptr }}.
     */
    String type();

    /**
     * @return The operand as written in IR text, without its type.
     */
    String render();
}
