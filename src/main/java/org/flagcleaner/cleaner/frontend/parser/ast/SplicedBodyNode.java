package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;

import java.util.List;

/**
 * The surviving body of a resolved conditional block, put in place of the block.
 *
 * @param leadingTrivia The trivia that preceded the block's {@code #if} token.
 * @param body The body items of the winning clause.
 */
public record SplicedBodyNode(List<TriviaPiece> leadingTrivia, List<SyntaxNode> body) implements SyntaxNode {

    public SplicedBodyNode {
        leadingTrivia = List.copyOf(leadingTrivia);
        body = List.copyOf(body);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body;
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new SplicedBodyNode(leadingTrivia, newChildren);
    }
}
