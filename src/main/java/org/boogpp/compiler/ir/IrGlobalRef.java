package org.boogpp.compiler.ir;

/**
 * The address of a module-level global, such as a string constant.
 *
 * @param name The global name without the {@code @} sigil.
 */
public record IrGlobalRef(String name) implements IrValue {

    @Override
    public String type() {
        return "ptr";
    }

    @Override
    public String render() {
        return "@" + name;
    }
}
