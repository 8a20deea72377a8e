package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;

/**
 * Evaluates conditions recursively over the parsed tree, so operator precedence is respected:
 * {@code !} binds tighter than {@code &&}, which binds tighter than {@code ||}.
 */
public class StructuralConditionEvaluator implements IConditionEvaluator {

    @Override
    public boolean evaluate(ConditionExpr condition, String targetFlag) {
        if (condition instanceof ConditionExpr.Identifier identifier) {
            return identifier.name().equals(targetFlag);
        } else if (condition instanceof ConditionExpr.IntegerLiteral literal) {
            return literal.value() > 0;
        } else if (condition instanceof ConditionExpr.Not not) {
            return !evaluate(not.operand(), targetFlag);
        } else if (condition instanceof ConditionExpr.And and) {
            return evaluate(and.left(), targetFlag) && evaluate(and.right(), targetFlag);
        } else if (condition instanceof ConditionExpr.Or or) {
            return evaluate(or.left(), targetFlag) || evaluate(or.right(), targetFlag);
        } else if (condition instanceof ConditionExpr.Parenthesized parenthesized) {
            return evaluate(parenthesized.inner(), targetFlag);
        }
        throw new IllegalArgumentException("Cannot evaluate condition: " + condition);
    }
}
