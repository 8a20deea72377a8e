package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;

/**
 * Evaluates the condition of a clause with the target flag fixed to enabled.
 * <p>
 * Callers only pass conditions whose sole flag name is the target flag. Integer literals are
 * true when greater than zero.
 */
public interface IConditionEvaluator {

    /**
     * Evaluates a condition.
     * @param condition The condition to evaluate. Must not be {@link ConditionExpr.Unsupported}.
     * @param targetFlag The flag assumed to be enabled.
     * @return The truth value of the condition.
     */
    boolean evaluate(ConditionExpr condition, String targetFlag);
}
