package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.Token;

import java.util.List;

/**
 * A code block or member block delimited by braces.
 *
 * @param leftBrace The opening brace.
 * @param items The items between the braces.
 * @param rightBrace The closing brace, or {@code null} if the file ended first.
 */
public record BraceGroupNode(Token leftBrace, List<SyntaxNode> items, Token rightBrace) implements SyntaxNode {

    public BraceGroupNode {
        items = List.copyOf(items);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return items;
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new BraceGroupNode(leftBrace, newChildren, rightBrace);
    }
}
