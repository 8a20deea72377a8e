package org.flagcleaner.cleaner.frontend;

import org.flagcleaner.cleaner.api.CleanerErrorCode;
import org.flagcleaner.cleaner.diagnostics.Diagnostic;
import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.lexer.Lexer;
import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.lexer.TokenType;
import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify token types, the placement of trivia, and that no input character is lost.
 */
public class LexerTest {

    private List<Token> lex(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private static String concat(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            token.leadingTrivia().forEach(piece -> sb.append(piece.text()));
            sb.append(token.text());
            token.trailingTrivia().forEach(piece -> sb.append(piece.text()));
        }
        return sb.toString();
    }

    /**
     * Verifies that a directive line and a declaration are split into the expected token types.
     */
    @Test
    @Tag("unit")
    void testDirectiveAndDeclarationTokenization() {
        // Arrange
        String source = String.join("\n",
                "#if !FEATURE_FLAG",
                "let x = 42",
                "#endif");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.POUND_IF, "#if"),
                tuple(TokenType.PREFIX_OPERATOR, "!"),
                tuple(TokenType.IDENTIFIER, "FEATURE_FLAG"),
                tuple(TokenType.KEYWORD, "let"),
                tuple(TokenType.IDENTIFIER, "x"),
                tuple(TokenType.BINARY_OPERATOR, "="),
                tuple(TokenType.INTEGER_LITERAL, "42"),
                tuple(TokenType.POUND_ENDIF, "#endif"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that newlines go to the following token and same-line comments stay trailing.
     */
    @Test
    @Tag("unit")
    void testNewlinesAreLeadingTriviaOfNextToken() {
        // Arrange
        String source = "#else // FLAG\n\n    let a = 1";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        Token pound = tokens.get(0);
        assertThat(pound.type()).isEqualTo(TokenType.POUND_ELSE);
        assertThat(pound.trailingTrivia()).containsExactly(
                new TriviaPiece.Spaces(1), new TriviaPiece.LineComment("// FLAG"));
        Token let = tokens.get(1);
        assertThat(let.leadingTrivia()).containsExactly(new TriviaPiece.Newlines(2), new TriviaPiece.Spaces(4));
        assertThat(let.hasNewlineBefore()).isTrue();
        assertThat(let.line()).isEqualTo(3);
        assertThat(let.column()).isEqualTo(5);
    }

    /**
     * Verifies that a block comment spanning lines is never trailing trivia.
     */
    @Test
    @Tag("unit")
    void testMultiLineBlockCommentBecomesLeadingTrivia() {
        // Arrange
        String source = "let a = 1 /* one\n two */ let b = 2";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        Token one = tokens.get(3);
        assertThat(one.text()).isEqualTo("1");
        assertThat(one.trailingTrivia()).containsExactly(new TriviaPiece.Spaces(1));
        Token nextLet = tokens.get(4);
        assertThat(nextLet.leadingTrivia()).startsWith(new TriviaPiece.BlockComment("/* one\n two */"));
        assertThat(nextLet.hasNewlineBefore()).isTrue();
    }

    /**
     * Verifies that comment flavours are told apart.
     */
    @Test
    @Tag("unit")
    void testCommentKinds() {
        // Arrange
        String source = "/// doc\n// plain\n/** block doc */\n/* /* nested */ */\nlet a = 1";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).leadingTrivia())
                .filteredOn(TriviaPiece::isComment)
                .containsExactly(
                        new TriviaPiece.DocLineComment("/// doc"),
                        new TriviaPiece.LineComment("// plain"),
                        new TriviaPiece.DocBlockComment("/** block doc */"),
                        new TriviaPiece.BlockComment("/* /* nested */ */"));
    }

    /**
     * Verifies that strings containing directive-like text, interpolation and raw delimiters are single tokens.
     */
    @Test
    @Tag("unit")
    void testStringLiterals() {
        // Arrange
        String source = String.join("\n",
                "let a = \"#if FLAG \\(value(\")\"))\"",
                "let b = #\"raw \\n \"quoted\"\"#",
                "let c = \"\"\"",
                "  #endif",
                "  \"\"\"");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).filteredOn(token -> token.type() == TokenType.STRING_LITERAL)
                .extracting(Token::text)
                .containsExactly(
                        "\"#if FLAG \\(value(\")\"))\"",
                        "#\"raw \\n \"quoted\"\"#",
                        "\"\"\"\n  #endif\n  \"\"\"");
        assertThat(tokens).noneMatch(token -> token.type() == TokenType.POUND_ENDIF);
    }

    /**
     * Verifies that operators are classified by the whitespace around them.
     */
    @Test
    @Tag("unit")
    void testOperatorClassification() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex("a && !b || c! (!d)", diagnostics);

        // Assert
        assertThat(tokens).filteredOn(token -> token.text().matches("[!&|]+"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.BINARY_OPERATOR, "&&"),
                        tuple(TokenType.PREFIX_OPERATOR, "!"),
                        tuple(TokenType.BINARY_OPERATOR, "||"),
                        tuple(TokenType.POSTFIX_OPERATOR, "!"),
                        tuple(TokenType.PREFIX_OPERATOR, "!"));
    }

    /**
     * Verifies that a bare regex literal is one token, so a quote inside it does not open a string.
     */
    @Test
    @Tag("unit")
    void testRegexLiteralContainingQuote() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = "let r = /a\"b\\/c/\nlet m = text.contains(/[0-9]+/)";

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).filteredOn(token -> token.type() == TokenType.REGEX_LITERAL)
                .extracting(Token::text)
                .containsExactly("/a\"b\\/c/", "/[0-9]+/");
        assertThat(concat(tokens)).isEqualTo(source);
    }

    /**
     * Verifies that slashes after an operand stay division operators.
     */
    @Test
    @Tag("unit")
    void testDivisionIsNotRegexLiteral() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex("let q = a/b/c + (x) / 2 / y\nlet h = [1] / z", diagnostics);

        // Assert
        assertThat(tokens).extracting(Token::type).doesNotContain(TokenType.REGEX_LITERAL);
        assertThat(tokens).filteredOn(token -> token.text().equals("/")).hasSize(5);
    }

    /**
     * Verifies that both spellings of else-if map to the same token type.
     */
    @Test
    @Tag("unit")
    void testElseIfSpellings() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex("#elseif A\n#elif B\n#available", diagnostics);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.POUND_ELSEIF, TokenType.IDENTIFIER,
                TokenType.POUND_ELSEIF, TokenType.IDENTIFIER,
                TokenType.POUND_KEYWORD, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that the token stream reproduces the input exactly, including CRLF line endings and a shebang.
     */
    @Test
    @Tag("unit")
    void testLosslessRoundTrip() {
        // Arrange
        String source = "#!/usr/bin/env swift\r\n"
                + "import Foundation\r\n\r\n"
                + "@objc public final class A: B { // members\r\n"
                + "\tvar x: [Int] = [0x1F, 1_000, 2.5e3]\r\n"
                + "}\r\n";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = lex(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(concat(tokens)).isEqualTo(source);
        assertThat(tokens.get(0).leadingTrivia().get(0)).isInstanceOf(TriviaPiece.Shebang.class);
        assertThat(tokens.get(tokens.size() - 1).leadingTrivia())
                .containsExactly(new TriviaPiece.CarriageReturnLineFeeds(1));
    }

    /**
     * Verifies that unterminated strings and comments are reported as errors.
     */
    @Test
    @Tag("unit")
    void testUnterminatedLiteralsAreErrors() {
        // Arrange
        DiagnosticsEngine stringDiagnostics = new DiagnosticsEngine();
        DiagnosticsEngine commentDiagnostics = new DiagnosticsEngine();

        // Act
        lex("let a = \"open\nlet b = 1", stringDiagnostics);
        lex("let a = 1\n/* never closed", commentDiagnostics);

        // Assert
        assertThat(stringDiagnostics.getErrors()).extracting(Diagnostic::code, Diagnostic::lineNumber)
                .containsExactly(tuple(CleanerErrorCode.UNTERMINATED_STRING, 1));
        assertThat(commentDiagnostics.getErrors()).extracting(Diagnostic::code, Diagnostic::lineNumber)
                .containsExactly(tuple(CleanerErrorCode.UNTERMINATED_COMMENT, 2));
    }
}
