package org.boogpp.compiler.ir;

/**
 * Typed virtual register. Each register is defined exactly once in its function.
 *
 * @param name The register name without the {@code %} sigil.
 * @param type The IR type of the value held.
 */
public record IrReg(String name, String type) implements IrValue {

    @Override
    public String render() {
        return "%" + name;
    }
}
