package org.boogpp.compiler.frontend.semantics.types;

import java.math.BigInteger;

/**
 * The primitive types of the language.
 */
public enum PrimitiveKind {
    I8("i8", 8, true, true),
    I16("i16", 16, true, true),
    I32("i32", 32, true, true),
    I64("i64", 64, true, true),
    U8("u8", 8, true, false),
    U16("u16", 16, true, false),
    U32("u32", 32, true, false),
    U64("u64", 64, true, false),
    F32("f32", 32, false, true),
    F64("f64", 64, false, true),
    BOOL("bool", 1, false, false),
    CHAR("char", 32, false, false),
    STRING("string", 64, false, false);

    private final String typeName;
    private final int bits;
    private final boolean integer;
    private final boolean signed;

    PrimitiveKind(String typeName, int bits, boolean integer, boolean signed) {
        this.typeName = typeName;
        this.bits = bits;
        this.integer = integer;
        this.signed = signed;
    }

    public String typeName() {
        return typeName;
    }

    public int bits() {
        return bits;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    public boolean isNumeric() {
        return integer || isFloat();
    }

    /**
     * @return true for signed integers and floats.
     */
    public boolean isSigned() {
        return signed;
    }

    /**
     * @return The smallest value of an integer kind.
     */
    public BigInteger minValue() {
        if (!integer) {
            throw new IllegalStateException(typeName + " is not an integer type");
        }
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    /**
     * @return The largest value of an integer kind.
     */
    public BigInteger maxValue() {
        if (!integer) {
            throw new IllegalStateException(typeName + " is not an integer type");
        }
        return signed
                ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    /**
     * @param value An integer value.
     * @return true if the value is representable in this integer kind.
     */
    public boolean fits(BigInteger value) {
        return value.compareTo(minValue()) >= 0 && value.compareTo(maxValue()) <= 0;
    }
}
