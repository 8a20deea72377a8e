package org.flagcleaner.cleaner.frontend.lexer;

import java.util.List;

/**
 * A single token extracted from Swift source by the {@link Lexer}, together with the trivia around it.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param leadingTrivia Whitespace and comments between the previous token's line end and this token.
 * @param trailingTrivia Whitespace and comments after this token up to, not including, the next newline.
 * @param line The line number where the token begins.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        List<TriviaPiece> leadingTrivia,
        List<TriviaPiece> trailingTrivia,
        int line,
        int column
) {
    public Token {
        leadingTrivia = List.copyOf(leadingTrivia);
        trailingTrivia = List.copyOf(trailingTrivia);
    }

    /**
     * Returns a copy of this token with different leading trivia.
     * @param trivia The new leading trivia.
     * @return The new token.
     */
    public Token withLeadingTrivia(List<TriviaPiece> trivia) {
        return new Token(type, text, trivia, trailingTrivia, line, column);
    }

    /**
     * Reports whether a newline separates this token from the one before it.
     * @return {@code true} if the leading trivia contains a line break.
     */
    public boolean hasNewlineBefore() {
        return leadingTrivia.stream().anyMatch(TriviaPiece::isNewline);
    }

    /**
     * Checks the token type and text at once.
     * @param expectedType The expected type.
     * @param expectedText The expected text.
     * @return {@code true} if both match.
     */
    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }
}
