package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;

import java.util.List;

/**
 * An {@code #if ... #endif} region.
 * <p>
 * The first clause is always {@link ClauseKind#IF}; an {@link ClauseKind#ELSE} clause, if present, is last.
 *
 * @param clauses The clauses in source order.
 * @param endif The {@code #endif} token, or {@code null} if the block was never closed.
 */
public record ConditionalBlockNode(List<ClauseNode> clauses, Token endif) implements SyntaxNode {

    public ConditionalBlockNode {
        clauses = List.copyOf(clauses);
    }

    /**
     * Returns the leading trivia of the {@code #if} token.
     * @return The trivia in front of the block.
     */
    public List<TriviaPiece> leadingTrivia() {
        return clauses.get(0).poundKeyword().leadingTrivia();
    }

    /**
     * Returns the same-line trivia after the {@code #endif} token.
     * @return The trivia after the block, up to the end of the {@code #endif} line.
     */
    public List<TriviaPiece> trailingTrivia() {
        return endif == null ? List.of() : endif.trailingTrivia();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.copyOf(clauses);
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new ConditionalBlockNode(newChildren.stream().map(ClauseNode.class::cast).toList(), endif);
    }
}
