package org.boogpp.compiler.frontend.parser.ast;

/**
 * Binary operators with their binding strength. Higher precedence binds tighter;
 * only {@link #POWER} is right-associative.
 */
public enum BinaryOperator {
    OR("or", 1, Category.LOGICAL),
    AND("and", 2, Category.LOGICAL),
    EQ("==", 3, Category.EQUALITY),
    NE("!=", 3, Category.EQUALITY),
    LT("<", 4, Category.RELATIONAL),
    LE("<=", 4, Category.RELATIONAL),
    GT(">", 4, Category.RELATIONAL),
    GE(">=", 4, Category.RELATIONAL),
    BIT_OR("|", 5, Category.BITWISE),
    BIT_XOR("^", 6, Category.BITWISE),
    BIT_AND("&", 7, Category.BITWISE),
    SHL("<<", 8, Category.BITWISE),
    SHR(">>", 8, Category.BITWISE),
    ADD("+", 9, Category.ARITHMETIC),
    SUB("-", 9, Category.ARITHMETIC),
    MUL("*", 10, Category.ARITHMETIC),
    DIV("/", 10, Category.ARITHMETIC),
    MOD("%", 10, Category.ARITHMETIC),
    POWER("**", 11, Category.ARITHMETIC);

    public enum Category {
        LOGICAL, EQUALITY, RELATIONAL, BITWISE, ARITHMETIC
    }

    private final String symbol;
    private final int precedence;
    private final Category category;

    BinaryOperator(String symbol, int precedence, Category category) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Category category() {
        return category;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    /**
     * @return true for operators whose result is {@code bool}.
     */
    public boolean isComparison() {
        return category == Category.EQUALITY || category == Category.RELATIONAL;
    }
}
