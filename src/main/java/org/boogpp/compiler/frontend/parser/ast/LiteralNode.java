package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.math.BigInteger;

/**
 * A literal constant.
 *
 * @param kind   The lexical kind.
 * @param value  A {@link BigInteger}, {@link Double}, {@link String}, {@link Character} or {@link Boolean}.
 * @param suffix The explicit numeric type suffix (e.g. {@code u8}), or null.
 * @param source The position of the literal.
 */
public record LiteralNode(Kind kind, Object value, String suffix, SourceInfo source) implements ExpressionNode {

    public enum Kind {
        INTEGER, FLOAT, STRING, CHAR, BOOL
    }

    /**
     * @return The integer value; only valid for {@link Kind#INTEGER}.
     */
    public BigInteger integerValue() {
        return (BigInteger) value;
    }
}
