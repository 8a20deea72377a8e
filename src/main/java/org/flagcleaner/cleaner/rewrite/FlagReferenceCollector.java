package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.ClauseKind;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionalBlockNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the distinct flag names referenced by the conditions of a conditional block.
 */
public class FlagReferenceCollector {

    /**
     * Collects the flag names of every {@code #if} and {@code #elseif} condition in the block.
     * Integer literals contribute nothing.
     *
     * @param block The block to inspect.
     * @return The flag names in order of first appearance, or empty if any condition is unsupported.
     */
    public Optional<Set<String>> collect(ConditionalBlockNode block) {
        Set<String> flags = new LinkedHashSet<>();
        for (ClauseNode clause : block.clauses()) {
            if (clause.kind() == ClauseKind.ELSE) {
                continue;
            }
            if (clause.condition() == null || !collect(clause.condition(), flags)) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableSet(flags));
    }

    private boolean collect(ConditionExpr expr, Set<String> flags) {
        if (expr instanceof ConditionExpr.Identifier identifier) {
            flags.add(identifier.name());
            return true;
        } else if (expr instanceof ConditionExpr.IntegerLiteral) {
            return true;
        } else if (expr instanceof ConditionExpr.Not not) {
            return collect(not.operand(), flags);
        } else if (expr instanceof ConditionExpr.And and) {
            return collect(and.left(), flags) && collect(and.right(), flags);
        } else if (expr instanceof ConditionExpr.Or or) {
            return collect(or.left(), flags) && collect(or.right(), flags);
        } else if (expr instanceof ConditionExpr.Parenthesized parenthesized) {
            return collect(parenthesized.inner(), flags);
        }
        return false;
    }
}
