package org.flagcleaner.cleaner.frontend.parser.ast;

/**
 * The condition of an {@code #if} or {@code #elseif} directive.
 * <p>
 * Only flag names, integer literals, {@code !}, {@code &&}, {@code ||} and parentheses are modelled.
 * Anything else is kept as {@link Unsupported} so that the enclosing block is left alone.
 */
public sealed interface ConditionExpr permits
        ConditionExpr.Identifier,
        ConditionExpr.IntegerLiteral,
        ConditionExpr.Not,
        ConditionExpr.And,
        ConditionExpr.Or,
        ConditionExpr.Parenthesized,
        ConditionExpr.Unsupported {

    /** A flag name such as {@code DEBUG}. */
    record Identifier(String name) implements ConditionExpr {
    }

    /** An integer literal such as {@code 0} or {@code 1}. */
    record IntegerLiteral(long value) implements ConditionExpr {
    }

    /** Prefix negation. */
    record Not(ConditionExpr operand) implements ConditionExpr {
    }

    /** Conjunction. */
    record And(ConditionExpr left, ConditionExpr right) implements ConditionExpr {
    }

    /** Disjunction. */
    record Or(ConditionExpr left, ConditionExpr right) implements ConditionExpr {
    }

    /** A parenthesized sub-condition. */
    record Parenthesized(ConditionExpr inner) implements ConditionExpr {
    }

    /**
     * A condition using syntax outside the modelled subset, such as {@code os(iOS)} or {@code true}.
     *
     * @param reason Why the condition could not be modelled.
     */
    record Unsupported(String reason) implements ConditionExpr {
    }
}
