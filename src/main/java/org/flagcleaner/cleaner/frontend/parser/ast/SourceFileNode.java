package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.Token;

import java.util.List;

/**
 * The root of a parsed Swift file.
 *
 * @param items The top-level items in source order.
 * @param endOfFile The end-of-file token, whose leading trivia holds everything after the last item.
 */
public record SourceFileNode(List<SyntaxNode> items, Token endOfFile) implements SyntaxNode {

    public SourceFileNode {
        items = List.copyOf(items);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return items;
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new SourceFileNode(newChildren, endOfFile);
    }
}
