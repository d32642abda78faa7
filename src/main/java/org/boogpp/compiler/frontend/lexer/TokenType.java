package org.boogpp.compiler.frontend.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    FUNC("func"), LET("let"), VAR("var"), IF("if"), ELIF("elif"), ELSE("else"),
    WHILE("while"), FOR("for"), IN("in"), MATCH("match"), CASE("case"), RETURN("return"),
    IMPORT("import"), FROM("from"), MODULE("module"),
    TRY_CHAIN("try_chain"), PRIMARY("primary"), SECONDARY("secondary"), FALLBACK("fallback"),
    TRUE("true"), FALSE("false"), AND("and"), OR("or"), NOT("not"),
    PASS("pass"), BREAK("break"), CONTINUE("continue"),

    // Type keywords.
    I8("i8"), I16("i16"), I32("i32"), I64("i64"),
    U8("u8"), U16("u16"), U32("u32"), U64("u64"),
    F32("f32"), F64("f64"), BOOL("bool"), CHAR("char"), STRING("string"), VOID("void"),
    PTR("ptr"), ARRAY("array"), SLICE("slice"), TUPLE("tuple"),
    STATUS("status"), HANDLE("handle"), RESULT("result"),

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** An integer literal; the value is a {@link NumberLiteral}. */
    INTEGER_LITERAL,
    /** A float literal; the value is a {@link NumberLiteral}. */
    FLOAT_LITERAL,
    /** A string literal; the value is the unescaped content. */
    STRING_LITERAL,
    /** A character literal; the value is a {@link Character}. */
    CHAR_LITERAL,

    // Operators.
    PLUS, MINUS, STAR, SLASH, PERCENT, POWER,
    EQ, NE, LT, GT, LE, GE,
    ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
    AMPERSAND, PIPE, CARET, TILDE, LSHIFT, RSHIFT,

    // Punctuation.
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
    COMMA, DOT, COLON, SEMICOLON, ARROW, AT, RANGE,

    // Structure.
    /** End of a logical line that had content. */
    NEWLINE,
    /** The indentation width increased. */
    INDENT,
    /** The indentation width returned to an enclosing level. */
    DEDENT,
    /** Represents the end of the source file. */
    END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.keyword != null) {
                KEYWORDS.put(type.keyword, type);
            }
        }
    }

    private final String keyword;

    TokenType() {
        this(null);
    }

    TokenType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Looks up the keyword token type for an identifier-shaped word.
     * @param word The word as written in the source.
     * @return The keyword type, or {@link #IDENTIFIER} if the word is not reserved.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    /**
     * @return true if this token type names a built-in type.
     */
    public boolean isTypeKeyword() {
        return ordinal() >= I8.ordinal() && ordinal() <= RESULT.ordinal();
    }

    /**
     * @return The reserved word, or null for non-keyword tokens.
     */
    public String keyword() {
        return keyword;
    }
}
