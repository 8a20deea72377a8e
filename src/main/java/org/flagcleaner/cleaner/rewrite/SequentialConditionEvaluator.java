package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Evaluates conditions left to right in source order with an operand/operator stack.
 * <p>
 * A pending {@code &&}, {@code ||} or {@code !} is collapsed as soon as its right operand is known,
 * so operators are applied in the order they appear rather than by precedence.
 * {@code F || F && 0} therefore yields {@code false}. A closing parenthesis pops back to its
 * opening one and feeds the enclosed result in as a single operand. An empty stack is true.
 * <p>
 * Every flag name counts as enabled. Blocks mentioning any other flag never reach an evaluator.
 */
public class SequentialConditionEvaluator implements IConditionEvaluator {

    private static final String TRUE = "1";
    private static final String FALSE = "0";
    private static final String NOT = "!";
    private static final String AND = "&&";
    private static final String OR = "||";
    private static final String OPEN = "(";
    private static final String CLOSE = ")";

    @Override
    public boolean evaluate(ConditionExpr condition, String targetFlag) {
        List<String> tokens = new ArrayList<>();
        flatten(condition, tokens);

        Deque<String> stack = new ArrayDeque<>();
        for (String token : tokens) {
            switch (token) {
                case NOT, AND, OR, OPEN -> stack.push(token);
                case CLOSE -> {
                    String value = stack.isEmpty() ? TRUE : stack.peek();
                    String popped;
                    do {
                        popped = stack.isEmpty() ? OPEN : stack.pop();
                    } while (!OPEN.equals(popped));
                    append(stack, value);
                }
                default -> append(stack, token);
            }
        }
        return stack.isEmpty() || TRUE.equals(stack.peek());
    }

    private void append(Deque<String> stack, String value) {
        String top = stack.peek();
        if (AND.equals(top) || OR.equals(top)) {
            String operator = stack.pop();
            String left = stack.isEmpty() ? TRUE : stack.pop();
            boolean result = AND.equals(operator)
                    ? TRUE.equals(left) && TRUE.equals(value)
                    : TRUE.equals(left) || TRUE.equals(value);
            append(stack, result ? TRUE : FALSE);
        } else if (NOT.equals(top)) {
            stack.pop();
            append(stack, TRUE.equals(value) ? FALSE : TRUE);
        } else {
            stack.push(value);
        }
    }

    /**
     * Writes the condition back out in source token order, with operands already reduced to "1" or "0".
     */
    private void flatten(ConditionExpr condition, List<String> out) {
        if (condition instanceof ConditionExpr.Identifier) {
            out.add(TRUE);
        } else if (condition instanceof ConditionExpr.IntegerLiteral literal) {
            out.add(literal.value() > 0 ? TRUE : FALSE);
        } else if (condition instanceof ConditionExpr.Not not) {
            out.add(NOT);
            flatten(not.operand(), out);
        } else if (condition instanceof ConditionExpr.And and) {
            flatten(and.left(), out);
            out.add(AND);
            flatten(and.right(), out);
        } else if (condition instanceof ConditionExpr.Or or) {
            flatten(or.left(), out);
            out.add(OR);
            flatten(or.right(), out);
        } else if (condition instanceof ConditionExpr.Parenthesized parenthesized) {
            out.add(OPEN);
            flatten(parenthesized.inner(), out);
            out.add(CLOSE);
        } else {
            throw new IllegalArgumentException("Cannot evaluate condition: " + condition);
        }
    }
}
