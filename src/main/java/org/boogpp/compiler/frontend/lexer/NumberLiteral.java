package org.boogpp.compiler.frontend.lexer;

import java.math.BigInteger;

/**
 * The value of a numeric literal token. The lexer only distinguishes integers from floats;
 * widths are decided by the type checker from the suffix or the context.
 *
 * @param value  A {@link BigInteger} for integer literals, a {@link Double} for float literals.
 * @param suffix The explicit type suffix (e.g. {@code u8}), or null.
 */
public record NumberLiteral(Number value, String suffix) {

    /**
     * @return true if the literal was written without fraction or exponent.
     */
    public boolean isInteger() {
        return value instanceof BigInteger;
    }

    /**
     * @return true if the literal carries an explicit type suffix.
     */
    public boolean hasSuffix() {
        return suffix != null;
    }
}
