package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.TreeWalker;
import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;
import org.flagcleaner.cleaner.frontend.parser.ast.BraceGroupNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionalBlockNode;
import org.flagcleaner.cleaner.frontend.parser.ast.RemovedBlockNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SplicedBodyNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SyntaxNode;
import org.flagcleaner.cleaner.frontend.parser.ast.TokenNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Resolves every conditional block that depends on the target flag alone.
 * <p>
 * A resolved block is replaced by the body of its winning clause, or by an empty placeholder when no
 * clause wins or the winner has no body. Blocks that mention other flags keep their directives, but
 * blocks nested inside them are still resolved. The tree is rewritten bottom-up, so a winning body
 * never contains an unresolved block on the target flag.
 */
public class BlockRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(BlockRewriter.class);

    private final FlagReferenceCollector collector;
    private final ClauseSelector selector;
    private final TreeWalker walker = new TreeWalker();

    /**
     * Creates a rewriter using the given evaluator.
     * @param evaluator The evaluator for clause conditions.
     */
    public BlockRewriter(IConditionEvaluator evaluator) {
        this(new FlagReferenceCollector(), new ClauseSelector(evaluator));
    }

    /**
     * Creates a rewriter from its parts.
     * @param collector The collector computing each block's flag set.
     * @param selector The selector picking each block's winning clause.
     */
    public BlockRewriter(FlagReferenceCollector collector, ClauseSelector selector) {
        this.collector = collector;
        this.selector = selector;
    }

    /**
     * Rewrites one file.
     * @param file The parsed file.
     * @param targetFlag The flag to resolve as enabled.
     * @return The new tree and the number of resolved blocks.
     */
    public RewriteResult rewrite(SourceFileNode file, String targetFlag) {
        Pass pass = new Pass(targetFlag);
        SyntaxNode tree = walker.transform(file, pass::visit);
        return new RewriteResult((SourceFileNode) tree, pass.resolvedBlocks);
    }

    private final class Pass {
        private final String targetFlag;
        private int resolvedBlocks;

        Pass(String targetFlag) {
            this.targetFlag = targetFlag;
        }

        SyntaxNode visit(SyntaxNode node) {
            return node instanceof ConditionalBlockNode block ? resolve(block) : node;
        }

        private SyntaxNode resolve(ConditionalBlockNode block) {
            int line = block.clauses().get(0).poundKeyword().line();
            Optional<Set<String>> flags = collector.collect(block);
            if (flags.isEmpty()) {
                LOG.debug("Keeping #if block at line {}: condition is not supported", line);
                return block;
            }
            if (!flags.get().equals(Set.of(targetFlag))) {
                return block;
            }

            resolvedBlocks++;
            Optional<ClauseNode> winner = selector.select(block.clauses(), targetFlag);
            if (winner.isEmpty() || winner.get().body().isEmpty()) {
                LOG.debug("Removing #if block at line {}: no surviving clause", line);
                return new RemovedBlockNode(withoutDirectiveIndent(block.leadingTrivia()), block.trailingTrivia());
            }

            LOG.debug("Keeping {} clause of #if block at line {}", winner.get().kind(), line);
            List<SyntaxNode> body = new ArrayList<>(winner.get().body());
            body.set(0, withFirstLeadingTrivia(body.get(0), BlockRewriter::dropOneLineBreak));
            return new SplicedBodyNode(withoutDirectiveIndent(block.leadingTrivia()), body);
        }
    }

    /**
     * Removes one line break from a leading newline run, so the body starts where the {@code #if} line was.
     */
    static List<TriviaPiece> dropOneLineBreak(List<TriviaPiece> trivia) {
        if (trivia.isEmpty()) {
            return trivia;
        }
        TriviaPiece replacement;
        TriviaPiece first = trivia.get(0);
        if (first instanceof TriviaPiece.Newlines newlines) {
            replacement = newlines.count() > 1 ? new TriviaPiece.Newlines(newlines.count() - 1) : null;
        } else if (first instanceof TriviaPiece.CarriageReturnLineFeeds crlf) {
            replacement = crlf.count() > 1 ? new TriviaPiece.CarriageReturnLineFeeds(crlf.count() - 1) : null;
        } else if (first instanceof TriviaPiece.CarriageReturns returns) {
            replacement = returns.count() > 1 ? new TriviaPiece.CarriageReturns(returns.count() - 1) : null;
        } else {
            return trivia;
        }

        List<TriviaPiece> adjusted = new ArrayList<>(trivia);
        if (replacement == null) {
            adjusted.remove(0);
        } else {
            adjusted.set(0, replacement);
        }
        return adjusted;
    }

    /**
     * Removes the spaces and tabs indenting the {@code #if} line, provided nothing else precedes the
     * directive on that line. The spliced body carries its own indentation.
     */
    static List<TriviaPiece> withoutDirectiveIndent(List<TriviaPiece> trivia) {
        int end = trivia.size();
        while (end > 0 && (trivia.get(end - 1) instanceof TriviaPiece.Spaces
                || trivia.get(end - 1) instanceof TriviaPiece.Tabs)) {
            end--;
        }
        if (end == trivia.size() || (end > 0 && !trivia.get(end - 1).isNewline())) {
            return trivia;
        }
        return List.copyOf(trivia.subList(0, end));
    }

    /**
     * Applies {@code edit} to the leading trivia of the first printed element of {@code node}.
     */
    private static SyntaxNode withFirstLeadingTrivia(SyntaxNode node, UnaryOperator<List<TriviaPiece>> edit) {
        if (node instanceof TokenNode tokenNode) {
            return new TokenNode(tokenNode.token().withLeadingTrivia(edit.apply(tokenNode.token().leadingTrivia())));
        } else if (node instanceof BraceGroupNode group) {
            return new BraceGroupNode(
                    group.leftBrace().withLeadingTrivia(edit.apply(group.leftBrace().leadingTrivia())),
                    group.items(), group.rightBrace());
        } else if (node instanceof ClauseNode clause) {
            return new ClauseNode(clause.kind(),
                    clause.poundKeyword().withLeadingTrivia(edit.apply(clause.poundKeyword().leadingTrivia())),
                    clause.conditionTokens(), clause.condition(), clause.body());
        } else if (node instanceof RemovedBlockNode removed) {
            return new RemovedBlockNode(edit.apply(removed.leadingTrivia()), removed.trailingTrivia());
        } else if (node instanceof SplicedBodyNode spliced && !spliced.leadingTrivia().isEmpty()) {
            return new SplicedBodyNode(edit.apply(spliced.leadingTrivia()), spliced.body());
        }

        List<SyntaxNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        List<SyntaxNode> updated = new ArrayList<>(children);
        updated.set(0, withFirstLeadingTrivia(children.get(0), edit));
        return node.reconstructWithChildren(updated);
    }
}
