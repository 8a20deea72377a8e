package org.flagcleaner.cleaner.frontend.parser.ast;

import org.flagcleaner.cleaner.frontend.lexer.Token;

import java.util.List;

/**
 * One branch of a conditional-compilation block.
 *
 * @param kind The clause kind.
 * @param poundKeyword The {@code #if}, {@code #elseif} or {@code #else} token.
 * @param conditionTokens The raw tokens of the condition on the directive line.
 * @param condition The parsed condition, or {@code null} for an {@link ClauseKind#ELSE} clause.
 * @param body The items guarded by this clause.
 */
public record ClauseNode(
        ClauseKind kind,
        Token poundKeyword,
        List<Token> conditionTokens,
        ConditionExpr condition,
        List<SyntaxNode> body
) implements SyntaxNode {

    public ClauseNode {
        conditionTokens = List.copyOf(conditionTokens);
        body = List.copyOf(body);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body;
    }

    @Override
    public SyntaxNode reconstructWithChildren(List<SyntaxNode> newChildren) {
        return new ClauseNode(kind, poundKeyword, conditionTokens, condition, newChildren);
    }
}
