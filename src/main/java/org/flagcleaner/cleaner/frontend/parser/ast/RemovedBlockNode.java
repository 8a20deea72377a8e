package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;

import java.util.List;

/**
 * The empty placeholder left behind by a resolved conditional block with no surviving body.
 * It contributes no declarations, only the trivia around the removed block.
 *
 * @param leadingTrivia The trivia that preceded the block's {@code #if} token.
 * @param trailingTrivia The same-line trivia that followed the block's {@code #endif} token.
 */
public record RemovedBlockNode(List<TriviaPiece> leadingTrivia, List<TriviaPiece> trailingTrivia)
        implements SyntaxNode {

    public RemovedBlockNode {
        leadingTrivia = List.copyOf(leadingTrivia);
        trailingTrivia = List.copyOf(trailingTrivia);
    }
}
