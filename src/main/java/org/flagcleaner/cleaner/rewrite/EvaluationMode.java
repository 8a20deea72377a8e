package org.flagcleaner.cleaner.rewrite;

import java.util.Locale;

/**
 * Selects how {@code #if} conditions are evaluated.
 */
public enum EvaluationMode {
    /** Left to right in source order. See {@link SequentialConditionEvaluator}. */
    SEQUENTIAL,
    /** Precedence-correct tree evaluation. See {@link StructuralConditionEvaluator}. */
    STRUCTURAL;

    /**
     * Creates the evaluator for this mode.
     * @return A new evaluator.
     */
    public IConditionEvaluator createEvaluator() {
        return switch (this) {
            case SEQUENTIAL -> new SequentialConditionEvaluator();
            case STRUCTURAL -> new StructuralConditionEvaluator();
        };
    }

    /**
     * Parses a configuration value such as {@code "sequential"}, ignoring case.
     * @param value The configured value.
     * @return The matching mode.
     * @throws IllegalArgumentException if the value names no mode.
     */
    public static EvaluationMode fromConfigValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown evaluator '" + value + "', expected 'sequential' or 'structural'", e);
        }
    }
}
