package org.boogpp.compiler.frontend.parser.ast;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("not"),
    BIT_NOT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
