package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.Token;

/**
 * A leaf wrapping a single token.
 *
 * @param token The wrapped token.
 */
public record TokenNode(Token token) implements SyntaxNode {
}
