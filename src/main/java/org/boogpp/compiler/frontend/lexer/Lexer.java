package org.boogpp.compiler.frontend.lexer;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Blocks are delimited by indentation. The lexer keeps a stack of indentation widths
 * and synthesizes {@link TokenType#INDENT}, {@link TokenType#DEDENT} and
 * {@link TokenType#NEWLINE} tokens, so the parser never looks at whitespace.
 * Blank lines and comment-only lines produce no tokens at all. Inside parentheses,
 * brackets and braces, line breaks are implicit joins.
 */
public class Lexer {

    private static final int TAB_WIDTH = 4;
    private static final Set<String> NUMERIC_SUFFIXES = Set.of(
            "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "f32", "f64");

    /**
     * An entry of the indentation stack. Synthetic levels are pushed after an inconsistent
     * dedent so that the following lines do not cascade; they produce no tokens.
     */
    private record IndentLevel(int width, boolean synthetic) {}

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private final Deque<IndentLevel> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int tokenLine = 1;
    private int tokenColumn = 1;
    private int nesting = 0;
    private boolean atLineStart = true;
    private boolean lineHasContent = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentStack.push(new IndentLevel(0, false));
    }

    /**
     * Performs the tokenization of the entire source code.
     * The stream always ends with a NEWLINE for the last content line, one DEDENT per
     * still-open indentation level and a final END_OF_FILE token.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && nesting == 0) {
                lineStart();
                continue;
            }
            markStart();
            scanToken();
        }

        markStart();
        if (lineHasContent) {
            addStructural(TokenType.NEWLINE);
        }
        while (indentStack.size() > 1) {
            IndentLevel level = indentStack.pop();
            if (!level.synthetic()) {
                addStructural(TokenType.DEDENT);
            }
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    /**
     * Measures the indentation of a physical line. Lines holding nothing but whitespace
     * or comments are consumed without producing tokens.
     */
    private void lineStart() {
        int width = 0;
        while (peek() == ' ' || peek() == '\t') {
            width += advance() == '\t' ? TAB_WIDTH : 1;
        }
        if (isAtEnd()) {
            return;
        }
        char c = peek();
        if (c == '\r') {
            advance();
            return;
        }
        if (c == '\n') {
            newline();
            return;
        }
        if (c == '#') {
            markStart();
            advance();
            if (isBlockCommentStart()) {
                blockComment();
                while (peek() == ' ' || peek() == '\t' || peek() == '\r') advance();
                if (!isAtEnd() && peek() != '\n' && peek() != '#') {
                    // Code follows the comment on the same line.
                    indent(column - 1);
                    atLineStart = false;
                }
            } else {
                skipLineComment();
            }
            return;
        }
        indent(width);
        atLineStart = false;
    }

    private void indent(int width) {
        tokenLine = line;
        tokenColumn = width + 1;
        int top = indentStack.peek().width();
        if (width > top) {
            indentStack.push(new IndentLevel(width, false));
            addStructural(TokenType.INDENT);
            return;
        }
        while (width < indentStack.peek().width()) {
            IndentLevel level = indentStack.pop();
            if (!level.synthetic()) {
                addStructural(TokenType.DEDENT);
            }
        }
        if (width != indentStack.peek().width()) {
            diagnostics.reportError(CompilerErrorCode.INCONSISTENT_INDENTATION,
                    "Indentation of " + width + " does not match any enclosing block.",
                    logicalFileName, line, width + 1);
            indentStack.push(new IndentLevel(width, true));
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t':
                break;
            case '\n':
                if (nesting == 0) {
                    if (lineHasContent) {
                        addStructural(TokenType.NEWLINE);
                    }
                    lineHasContent = false;
                    atLineStart = true;
                }
                newlineConsumed();
                break;
            case '#':
                if (isBlockCommentStart()) {
                    blockComment();
                } else {
                    skipLineComment();
                }
                break;
            case '"': string(); break;
            case '\'': character(); break;
            case '(': nesting++; addToken(TokenType.LPAREN); break;
            case '[': nesting++; addToken(TokenType.LBRACKET); break;
            case '{': nesting++; addToken(TokenType.LBRACE); break;
            case ')': closeNesting(); addToken(TokenType.RPAREN); break;
            case ']': closeNesting(); addToken(TokenType.RBRACKET); break;
            case '}': closeNesting(); addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '@': addToken(TokenType.AT); break;
            case '~': addToken(TokenType.TILDE); break;
            case '^': addToken(TokenType.CARET); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '|': addToken(TokenType.PIPE); break;
            case '.': addToken(match('.') ? TokenType.RANGE : TokenType.DOT); break;
            case '+': addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS); break;
            case '-':
                if (match('>')) {
                    addToken(TokenType.ARROW);
                } else {
                    addToken(match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS);
                }
                break;
            case '*':
                if (match('*')) {
                    addToken(TokenType.POWER);
                } else {
                    addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
                break;
            case '/': addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT); break;
            case '=': addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN); break;
            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    diagnostics.reportError(CompilerErrorCode.INVALID_CHARACTER,
                            "Unexpected character: '!' (use 'not' for negation)", logicalFileName, tokenLine, tokenColumn);
                }
                break;
            case '<':
                if (match('<')) {
                    addToken(TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;
            case '>':
                if (match('>')) {
                    addToken(TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError(CompilerErrorCode.INVALID_CHARACTER,
                            "Unexpected character: '" + c + "'", logicalFileName, tokenLine, tokenColumn);
                }
                break;
        }
    }

    private void closeNesting() {
        if (nesting > 0) nesting--;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.keywordOrIdentifier(text));
    }

    private void number() {
        int radix = 10;
        boolean isFloat = false;
        if (previous() == '0' && isRadixPrefix(peek())) {
            char prefix = Character.toLowerCase(advance());
            radix = prefix == 'x' ? 16 : prefix == 'b' ? 2 : 8;
            while (isDigitInRadix(peek(), radix) || peek() == '_') advance();
        } else {
            while (isDigit(peek()) || peek() == '_') advance();
            if (peek() == '.' && isDigit(peekNext())) {
                isFloat = true;
                advance();
                while (isDigit(peek()) || peek() == '_') advance();
            }
            if ((peek() == 'e' || peek() == 'E')
                    && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
                isFloat = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }
        int digitsEnd = current;

        String suffix = null;
        if (isAlpha(peek())) {
            int suffixStart = current;
            while (isAlphaNumeric(peek())) advance();
            suffix = source.substring(suffixStart, current);
        }

        String text = source.substring(start, current);
        if (suffix != null && (!NUMERIC_SUFFIXES.contains(suffix) || (isFloat && suffix.charAt(0) != 'f'))) {
            diagnostics.reportError(CompilerErrorCode.INVALID_NUMBER_LITERAL,
                    "Invalid numeric literal: " + text, logicalFileName, tokenLine, tokenColumn);
            return;
        }

        String digits = source.substring(start, digitsEnd).replace("_", "");
        if (radix != 10) {
            digits = digits.substring(2);
        }
        try {
            boolean floatSuffix = suffix != null && suffix.charAt(0) == 'f';
            if (isFloat || floatSuffix) {
                double value = radix == 10 ? Double.parseDouble(digits) : new BigInteger(digits, radix).doubleValue();
                addToken(TokenType.FLOAT_LITERAL, new NumberLiteral(value, suffix));
            } else {
                addToken(TokenType.INTEGER_LITERAL, new NumberLiteral(new BigInteger(digits, radix), suffix));
            }
        } catch (NumberFormatException e) {
            diagnostics.reportError(CompilerErrorCode.INVALID_NUMBER_LITERAL,
                    "Invalid numeric literal: " + text, logicalFileName, tokenLine, tokenColumn);
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            char c = advance();
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                value.append(escape(advance()));
            } else {
                value.append(c);
            }
        }

        if (peek() != '"') {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED,
                    "Unterminated string.", logicalFileName, tokenLine, tokenColumn);
            return;
        }

        // The closing "
        advance();
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void character() {
        if (peek() == '\'') {
            advance();
            diagnostics.reportError(CompilerErrorCode.INVALID_CHARACTER,
                    "Empty character literal.", logicalFileName, tokenLine, tokenColumn);
            return;
        }
        if (isAtEnd() || peek() == '\n') {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED,
                    "Unterminated character literal.", logicalFileName, tokenLine, tokenColumn);
            return;
        }
        char c = advance();
        if (c == '\\' && !isAtEnd() && peek() != '\n') {
            c = escape(advance());
        }
        if (peek() != '\'') {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED,
                    "Unterminated character literal.", logicalFileName, tokenLine, tokenColumn);
            return;
        }
        advance();
        addToken(TokenType.CHAR_LITERAL, c);
    }

    private char escape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }

    /**
     * A block comment opens with exactly {@code ###} followed by whitespace or the end of input;
     * {@code ####...} rules are line comments. The first '#' has already been consumed.
     */
    private boolean isBlockCommentStart() {
        if (peek() != '#' || peekNext() != '#') {
            return false;
        }
        char after = peekAt(2);
        return after == '\0' || after == ' ' || after == '\t' || after == '\r' || after == '\n';
    }

    /**
     * Consumes a {@code ### ... ###} comment. The opening '#' has already been consumed.
     */
    private void blockComment() {
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '#' && peekNext() == '#' && peekAt(2) == '#') {
                advance();
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newlineConsumed();
            }
        }
        diagnostics.reportError(CompilerErrorCode.UNTERMINATED,
                "Unterminated block comment.", logicalFileName, tokenLine, tokenColumn);
    }

    private void skipLineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void newline() {
        advance();
        newlineConsumed();
    }

    private void newlineConsumed() {
        line++;
        column = 1;
    }

    private void markStart() {
        start = current;
        tokenLine = line;
        tokenColumn = column;
    }

    private void addStructural(TokenType type) {
        tokens.add(new Token(type, "", null, tokenLine, tokenColumn, logicalFileName));
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName));
        lineHasContent = true;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private static boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'b' || c == 'B' || c == 'o' || c == 'O';
    }

    private static boolean isDigitInRadix(char c, int radix) {
        return Character.digit(c, radix) >= 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
