package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.ClauseKind;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseNode;

import java.util.List;
import java.util.Optional;

/**
 * Picks the clause of a conditional block that survives once the target flag is enabled.
 */
public class ClauseSelector {

    private final IConditionEvaluator evaluator;

    /**
     * Creates a selector.
     * @param evaluator The evaluator used for {@code #if} and {@code #elseif} conditions.
     */
    public ClauseSelector(IConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Returns the first {@code #if}/{@code #elseif} clause whose condition holds, else the {@code #else} clause.
     * @param clauses The clauses of one block, in source order.
     * @param targetFlag The flag assumed to be enabled.
     * @return The winning clause, or empty if no condition holds and there is no {@code #else}.
     */
    public Optional<ClauseNode> select(List<ClauseNode> clauses, String targetFlag) {
        for (ClauseNode clause : clauses) {
            if (clause.kind() == ClauseKind.ELSE || evaluator.evaluate(clause.condition(), targetFlag)) {
                return Optional.of(clause);
            }
        }
        return Optional.empty();
    }
}
