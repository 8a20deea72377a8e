package org.flagcleaner.cleaner.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of a Swift syntax tree.
 * Nodes are immutable records; rewriting produces new nodes.
 */
public sealed interface SyntaxNode permits
        SourceFileNode,
        DeclarationNode,
        BraceGroupNode,
        ConditionalBlockNode,
        ClauseNode,
        TokenNode,
        SplicedBodyNode,
        RemovedBlockNode {

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children.
     *
     * @param newChildren The new children for this node, in the order returned by {@link #getChildren()}.
     * @return A new instance of this node with the new children, or this node if it has no children.
     */
    default SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return this;
    }
}
