package org.boogpp.compiler.frontend.lexer;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}: keywords, literals, operators and the synthesized
 * indentation tokens.
 */
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String... lines) {
        return new Lexer(String.join("\n", lines), diagnostics).scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void testFunctionHeaderTokenization() {
        List<Token> tokens = scan("func add(a: i32, b: i32) -> i32:", "    return a + b");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.FUNC, TokenType.IDENTIFIER, TokenType.LPAREN,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.I32, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.I32, TokenType.RPAREN,
                TokenType.ARROW, TokenType.I32, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.RETURN, TokenType.IDENTIFIER, TokenType.PLUS, TokenType.IDENTIFIER,
                TokenType.NEWLINE, TokenType.DEDENT, TokenType.END_OF_FILE);
        assertThat(tokens.get(1)).extracting(Token::text, Token::line, Token::column).containsExactly("add", 1, 6);
        assertThat(tokens.get(16)).extracting(Token::line, Token::column).containsExactly(2, 5);
    }

    @Test
    @Tag("unit")
    void testIndentsAndDedentsBalance() {
        List<Token> tokens = scan(
                "func f():",
                "    if true:",
                "        while x:",
                "            pass",
                "    let y = 1",
                "func g():",
                "    pass");

        assertThat(diagnostics.hasErrors()).isFalse();
        long indents = tokens.stream().filter(t -> t.type() == TokenType.INDENT).count();
        long dedents = tokens.stream().filter(t -> t.type() == TokenType.DEDENT).count();
        assertThat(indents).isEqualTo(4);
        assertThat(dedents).isEqualTo(indents);
    }

    @Test
    @Tag("unit")
    void testBlankAndCommentLinesProduceNoTokens() {
        List<Token> tokens = scan(
                "func f():",
                "",
                "    # a comment",
                "        # deeper comment",
                "    pass  # trailing",
                "###",
                "block comment",
                "###");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.FUNC, TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN, TokenType.COLON,
                TokenType.NEWLINE, TokenType.INDENT, TokenType.PASS, TokenType.NEWLINE, TokenType.DEDENT,
                TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testHashRulesAreLineComments() {
        List<Token> tokens = scan(
                "#### helpers ####",
                "let a = 1",
                "####",
                "let b = 2");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.LET, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER_LITERAL, TokenType.NEWLINE,
                TokenType.LET, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER_LITERAL, TokenType.NEWLINE,
                TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testLineBreaksInsideBracketsAreJoined() {
        List<Token> tokens = scan("let x = add(1,", "        2)");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).doesNotContain(TokenType.INDENT);
        assertThat(types(tokens).stream().filter(t -> t == TokenType.NEWLINE).count()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testTabsCountAsFourColumns() {
        scan("func f():", "\tlet a = 1", "    let b = 2");

        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void testInconsistentDedentIsReported() {
        scan("func f():", "    if x:", "        pass", "  pass");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INCONSISTENT_INDENTATION);
    }

    @Test
    @Tag("unit")
    void testNumericLiterals() {
        List<Token> tokens = scan("0xFF 0b1010 0o17 1_000 255u8 1.5 2e3 1.5f32 7f64");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.subList(0, 9)).extracting(Token::type).containsExactly(
                TokenType.INTEGER_LITERAL, TokenType.INTEGER_LITERAL, TokenType.INTEGER_LITERAL,
                TokenType.INTEGER_LITERAL, TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL,
                TokenType.FLOAT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.FLOAT_LITERAL);
        assertThat(tokens.get(0).value()).isEqualTo(new NumberLiteral(BigInteger.valueOf(255), null));
        assertThat(tokens.get(1).value()).isEqualTo(new NumberLiteral(BigInteger.valueOf(10), null));
        assertThat(tokens.get(2).value()).isEqualTo(new NumberLiteral(BigInteger.valueOf(15), null));
        assertThat(tokens.get(3).value()).isEqualTo(new NumberLiteral(BigInteger.valueOf(1000), null));
        assertThat(tokens.get(4).value()).isEqualTo(new NumberLiteral(BigInteger.valueOf(255), "u8"));
        assertThat(tokens.get(6).value()).isEqualTo(new NumberLiteral(2000.0, null));
        assertThat(tokens.get(7).value()).isEqualTo(new NumberLiteral(1.5, "f32"));
        assertThat(tokens.get(8).value()).isEqualTo(new NumberLiteral(7.0, "f64"));
    }

    @Test
    @Tag("unit")
    void testUnknownSuffixIsInvalidNumber() {
        scan("let x = 12abc");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INVALID_NUMBER_LITERAL);
    }

    @Test
    @Tag("unit")
    void testStringAndCharEscapes() {
        List<Token> tokens = scan("\"a\\tb\\n\\\"q\\\"\" '\\n' 'x' \"\\q\"");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).value()).isEqualTo("a\tb\n\"q\"");
        assertThat(tokens.get(1).value()).isEqualTo('\n');
        assertThat(tokens.get(2).value()).isEqualTo('x');
        assertThat(tokens.get(3).value()).isEqualTo("q");
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringAndBlockComment() {
        scan("let s = \"open", "### never closed");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNTERMINATED, CompilerErrorCode.UNTERMINATED);
    }

    @Test
    @Tag("unit")
    void testInvalidCharacterKeepsScanning() {
        List<Token> tokens = scan("let a = $ + !b");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INVALID_CHARACTER, CompilerErrorCode.INVALID_CHARACTER);
        assertThat(types(tokens)).contains(TokenType.PLUS, TokenType.IDENTIFIER);
    }

    @Test
    @Tag("unit")
    void testOperators() {
        List<Token> tokens = scan("a ** b != c <= d << e >> f += g -> h .. i == j %= k");

        assertThat(types(tokens)).containsSubsequence(
                TokenType.POWER, TokenType.NE, TokenType.LE, TokenType.LSHIFT, TokenType.RSHIFT,
                TokenType.PLUS_ASSIGN, TokenType.ARROW, TokenType.RANGE, TokenType.EQ, TokenType.PERCENT_ASSIGN);
    }

    @Test
    @Tag("unit")
    void testKeywordsAndTypeKeywords() {
        List<Token> tokens = scan("try_chain primary secondary fallback status handle result ptr slice decorate");

        assertThat(types(tokens).subList(0, 10)).containsExactly(
                TokenType.TRY_CHAIN, TokenType.PRIMARY, TokenType.SECONDARY, TokenType.FALLBACK,
                TokenType.STATUS, TokenType.HANDLE, TokenType.RESULT, TokenType.PTR, TokenType.SLICE,
                TokenType.IDENTIFIER);
        assertThat(TokenType.STATUS.isTypeKeyword()).isTrue();
        assertThat(TokenType.FALLBACK.isTypeKeyword()).isFalse();
    }
}
