package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

/**
 * A compile-time constant argument of a decorator.
 *
 * @param name   The option name.
 * @param kind   The lexical kind of the value.
 * @param value  A {@link Long}, {@link Double}, {@link String} or {@link Boolean}; symbols are stored as their text.
 * @param source The position of the argument.
 */
public record DecoratorArgument(String name, Kind kind, Object value, SourceInfo source) {

    /**
     * The lexical kinds a decorator argument may have.
     */
    public enum Kind {
        INTEGER, FLOAT, STRING, BOOL, SYMBOL
    }

    /**
     * @return The value as text (symbol name, string content or number rendering).
     */
    public String asText() {
        return String.valueOf(value);
    }

    /**
     * @return The value as a long; only valid for {@link Kind#INTEGER}.
     */
    public long asLong() {
        return ((Number) value).longValue();
    }
}
