package org.boogpp.compiler.ir;

import java.math.BigInteger;

/**
 * A constant operand.
 *
 * @param literal The constant as written in IR text.
 * @param type    The IR type of the constant.
 */
public record IrConst(String literal, String type) implements IrValue {

    public static final IrConst TRUE = new IrConst("true", "i1");
    public static final IrConst FALSE = new IrConst("false", "i1");

    /**
     * @param value An integer value.
     * @param type  An integer IR type.
     * @return The constant.
     */
    public static IrConst integer(BigInteger value, String type) {
        return new IrConst(value.toString(), type);
    }

    /**
     * @param value An integer value.
     * @param type  An integer IR type.
     * @return The constant.
     */
    public static IrConst integer(long value, String type) {
        return new IrConst(Long.toString(value), type);
    }

    /**
     * Floating point constants are written as the hexadecimal bit pattern of a double, which
     * is exact for both {@code float} and {@code double}.
     *
     * @param value The value.
     * @param type  {@code float} or {@code double}.
     * @return The constant.
     */
    public static IrConst floating(double value, String type) {
        double exact = "float".equals(type) ? (double) (float) value : value;
        return new IrConst(String.format("0x%016X", Double.doubleToRawLongBits(exact)), type);
    }

    /**
     * @param value A boolean.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static IrConst bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @param type Any first-class IR type.
     * @return The all-zero value of that type.
     */
    public static IrConst zero(String type) {
        return switch (type) {
            case "i1" -> FALSE;
            case "i8", "i16", "i32", "i64" -> new IrConst("0", type);
            case "float", "double" -> floating(0.0, type);
            case "ptr" -> new IrConst("null", type);
            default -> new IrConst("zeroinitializer", type);
        };
    }

    @Override
    public String render() {
        return literal;
    }
}
