package org.flagcleaner.cleaner.frontend.parser.ast;

import java.util.List;

/**
 * One top-level or member item, such as a function declaration or a statement.
 *
 * @param kind The classification of the item.
 * @param parts The item's tokens, brace groups and nested conditional blocks, in source order.
 */
public record DeclarationNode(DeclarationKind kind, List<SyntaxNode> parts) implements SyntaxNode {

    public DeclarationNode {
        parts = List.copyOf(parts);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return parts;
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new DeclarationNode(kind, newChildren);
    }
}
