package org.flagcleaner.cleaner;

import com.typesafe.config.Config;
import org.flagcleaner.cleaner.rewrite.EvaluationMode;

import java.time.Duration;
import java.util.List;

/**
 * The settings of a cleanup run, read from the {@code flagcleaner} configuration block.
 *
 * @param swiftExtensions Extensions cleaned structurally, such as ".swift".
 * @param objcExtensions Extensions cleaned by text substitution, such as ".m".
 * @param excludedPathPatterns Glob patterns for directory or file names to skip.
 * @param evaluationMode How conditions are evaluated.
 * @param threads Worker threads; zero or less means one per available processor.
 * @param fileTimeout Maximum wait for one file; zero disables the timeout.
 */
public record CleanerSettings(
        List<String> swiftExtensions,
        List<String> objcExtensions,
        List<String> excludedPathPatterns,
        EvaluationMode evaluationMode,
        int threads,
        Duration fileTimeout
) {
    public CleanerSettings {
        swiftExtensions = List.copyOf(swiftExtensions);
        objcExtensions = List.copyOf(objcExtensions);
        excludedPathPatterns = List.copyOf(excludedPathPatterns);
        if (fileTimeout.isNegative()) {
            throw new IllegalArgumentException("file-timeout must not be negative: " + fileTimeout);
        }
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config The application configuration containing a {@code flagcleaner} block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if the evaluator name is unknown.
     */
    public static CleanerSettings fromConfig(Config config) {
        Config options = config.getConfig("flagcleaner");
        return new CleanerSettings(
                options.getStringList("swift-extensions"),
                options.getStringList("objc-extensions"),
                options.getStringList("excluded-path-patterns"),
                EvaluationMode.fromConfigValue(options.getString("evaluator")),
                options.getInt("threads"),
                options.getDuration("file-timeout"));
    }

    /**
     * Returns a copy with a different thread count.
     * @param newThreads The thread count.
     * @return The new settings.
     */
    public CleanerSettings withThreads(int newThreads) {
        return new CleanerSettings(swiftExtensions, objcExtensions, excludedPathPatterns, evaluationMode,
                newThreads, fileTimeout);
    }

    /**
     * Returns a copy with a different evaluation mode.
     * @param newMode The evaluation mode.
     * @return The new settings.
     */
    public CleanerSettings withEvaluationMode(EvaluationMode newMode) {
        return new CleanerSettings(swiftExtensions, objcExtensions, excludedPathPatterns, newMode,
                threads, fileTimeout);
    }

    /**
     * Resolves the configured thread count.
     * @return A positive thread count.
     */
    public int effectiveThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }
}
