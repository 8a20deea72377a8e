package org.flagcleaner.cleaner.frontend;

import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;
import org.flagcleaner.cleaner.frontend.parser.ast.BraceGroupNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionalBlockNode;
import org.flagcleaner.cleaner.frontend.parser.ast.DeclarationNode;
import org.flagcleaner.cleaner.frontend.parser.ast.RemovedBlockNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SplicedBodyNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SyntaxNode;
import org.flagcleaner.cleaner.frontend.parser.ast.TokenNode;

import java.util.List;

/**
 * Turns a syntax tree back into source text.
 * Printing an unmodified tree reproduces the parsed text byte for byte.
 */
public final class SourcePrinter {

    private final StringBuilder out = new StringBuilder();

    private SourcePrinter() {
    }

    /**
     * Prints a node and everything below it.
     * @param node The node to print.
     * @return The source text of the node.
     */
    public static String print(SyntaxNode node) {
        SourcePrinter printer = new SourcePrinter();
        printer.append(node);
        return printer.out.toString();
    }

    private void append(SyntaxNode node) {
        if (node instanceof TokenNode tokenNode) {
            append(tokenNode.token());
        } else if (node instanceof SourceFileNode file) {
            appendAll(file.items());
            append(file.endOfFile());
        } else if (node instanceof DeclarationNode declaration) {
            appendAll(declaration.parts());
        } else if (node instanceof BraceGroupNode group) {
            append(group.leftBrace());
            appendAll(group.items());
            append(group.rightBrace());
        } else if (node instanceof ConditionalBlockNode block) {
            block.clauses().forEach(this::append);
            append(block.endif());
        } else if (node instanceof ClauseNode clause) {
            append(clause.poundKeyword());
            clause.conditionTokens().forEach(this::append);
            appendAll(clause.body());
        } else if (node instanceof SplicedBodyNode spliced) {
            appendTrivia(spliced.leadingTrivia());
            appendAll(spliced.body());
        } else if (node instanceof RemovedBlockNode removed) {
            appendTrivia(removed.leadingTrivia());
            appendTrivia(removed.trailingTrivia());
        }
    }

    private void appendAll(List<SyntaxNode> nodes) {
        nodes.forEach(this::append);
    }

    private void append(Token token) {
        if (token == null) {
            return;
        }
        appendTrivia(token.leadingTrivia());
        out.append(token.text());
        appendTrivia(token.trailingTrivia());
    }

    private void appendTrivia(List<TriviaPiece> trivia) {
        for (TriviaPiece piece : trivia) {
            out.append(piece.text());
        }
    }
}
