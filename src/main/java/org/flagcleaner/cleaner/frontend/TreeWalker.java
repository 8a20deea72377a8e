package org.flagcleaner.cleaner.frontend;

import org.flagcleaner.cleaner.frontend.parser.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A generic class for searching and rewriting a syntax tree.
 * Instead of the Visitor pattern, the walker relies on {@link SyntaxNode#getChildren()} and
 * {@link SyntaxNode#reconstructWithChildren(List)}, so passes never need to know every node type.
 */
public class TreeWalker {

    /**
     * Searches the tree in pre-order and stops at the first node accepted by the predicate.
     * Children of an accepted node are not visited.
     * @param node The root of the search.
     * @param predicate The condition to look for.
     * @return {@code true} if any node matched.
     */
    public boolean anyMatch(SyntaxNode node, Predicate<SyntaxNode> predicate) {
        if (node == null) {
            return false;
        }
        if (predicate.test(node)) {
            return true;
        }
        for (SyntaxNode child : node.getChildren()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rewrites a tree bottom-up. Children are transformed first; a node whose children changed is
     * reconstructed, and the rewriter is then applied to the resulting node.
     * Untouched subtrees keep their identity.
     * @param node The root node to transform.
     * @param rewriter The rewrite applied to every node after its children.
     * @return The transformed node (may be the same or a new node).
     */
    public SyntaxNode transform(SyntaxNode node, UnaryOperator<SyntaxNode> rewriter) {
        if (node == null) {
            return null;
        }

        List<SyntaxNode> children = node.getChildren();
        List<SyntaxNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;
        for (SyntaxNode child : children) {
            SyntaxNode transformedChild = transform(child, rewriter);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        SyntaxNode current = childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
        return rewriter.apply(current);
    }
}
