package org.flagcleaner.cleaner.frontend.parser;

import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.lexer.TokenType;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;

import java.util.List;

/**
 * Parses the tokens of an {@code #if} or {@code #elseif} directive line into a {@link ConditionExpr}.
 * <p>
 * Grammar, loosest binding first:
 * <pre>
 *   or      := and ( "||" and )*
 *   and     := unary ( "&amp;&amp;" unary )*
 *   unary   := "!" unary | primary
 *   primary := IDENTIFIER | INTEGER | "(" or ")"
 * </pre>
 * Any other construct yields {@link ConditionExpr.Unsupported} instead of an error.
 */
public class ConditionParser {

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Creates a parser over the condition tokens of one directive.
     * @param tokens The tokens between the pound keyword and the end of its line.
     */
    public ConditionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the whole token list.
     * @return The condition tree, or {@link ConditionExpr.Unsupported} if the tokens fall outside the grammar.
     */
    public ConditionExpr parse() {
        try {
            ConditionExpr expr = or();
            if (!isAtEnd()) {
                throw new UnsupportedConditionException("unexpected '" + peek().text() + "' after condition");
            }
            return expr;
        } catch (UnsupportedConditionException e) {
            return new ConditionExpr.Unsupported(e.getMessage());
        }
    }

    private ConditionExpr or() {
        ConditionExpr left = and();
        while (matchOperator("||")) {
            left = new ConditionExpr.Or(left, and());
        }
        return left;
    }

    private ConditionExpr and() {
        ConditionExpr left = unary();
        while (matchOperator("&&")) {
            left = new ConditionExpr.And(left, unary());
        }
        return left;
    }

    private ConditionExpr unary() {
        if (matchOperator("!")) {
            return new ConditionExpr.Not(unary());
        }
        return primary();
    }

    private ConditionExpr primary() {
        if (isAtEnd()) {
            throw new UnsupportedConditionException("condition ends unexpectedly");
        }
        Token token = advance();
        switch (token.type()) {
            case IDENTIFIER:
                if (check(TokenType.LEFT_PAREN)) {
                    throw new UnsupportedConditionException("platform check '" + token.text() + "(...)'");
                }
                return new ConditionExpr.Identifier(token.text());
            case INTEGER_LITERAL:
                return new ConditionExpr.IntegerLiteral(parseInteger(token.text()));
            case LEFT_PAREN:
                ConditionExpr inner = or();
                if (!check(TokenType.RIGHT_PAREN)) {
                    throw new UnsupportedConditionException("missing ')'");
                }
                advance();
                return new ConditionExpr.Parenthesized(inner);
            default:
                throw new UnsupportedConditionException("'" + token.text() + "'");
        }
    }

    private long parseInteger(String text) {
        String digits = text.replace("_", "");
        try {
            if (digits.startsWith("0x")) return Long.parseLong(digits.substring(2), 16);
            if (digits.startsWith("0o")) return Long.parseLong(digits.substring(2), 8);
            if (digits.startsWith("0b")) return Long.parseLong(digits.substring(2), 2);
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new UnsupportedConditionException("integer literal '" + text + "'");
        }
    }

    private boolean matchOperator(String operator) {
        if (isAtEnd()) return false;
        TokenType type = peek().type();
        boolean isOperator = type == TokenType.BINARY_OPERATOR
                || type == TokenType.PREFIX_OPERATOR
                || type == TokenType.POSTFIX_OPERATOR;
        if (isOperator && peek().text().equals(operator)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private static final class UnsupportedConditionException extends RuntimeException {
        UnsupportedConditionException(String message) {
            super(message, null, false, false);
        }
    }
}
