package org.flagcleaner.cleaner;

import org.flagcleaner.cleaner.api.FileOutcome;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The immutable result of a cleanup run.
 *
 * @param root The scanned directory.
 * @param flag The removed flag.
 * @param totalFiles The number of source files found under the root.
 * @param outcomes The outcome of every file that mentioned the flag, in path order.
 * @param elapsed The wall-clock time spent cleaning.
 */
public record CleanupReport(
        Path root,
        String flag,
        int totalFiles,
        Map<Path, FileOutcome> outcomes,
        Duration elapsed
) {
    public CleanupReport {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /**
     * Returns the number of files that mentioned the flag.
     * @return The matched file count.
     */
    public int matchedFiles() {
        return outcomes.size();
    }

    /**
     * Returns the number of files that were written or deleted.
     * @return The changed file count.
     */
    public int changedFiles() {
        return (int) outcomes.values().stream().filter(FileOutcome::changed).count();
    }

    /**
     * Returns the matched files that needed no change.
     * @return The unchanged files, in path order.
     */
    public List<Path> unchangedFiles() {
        return outcomes.entrySet().stream()
                .filter(entry -> entry.getValue() instanceof FileOutcome.Unchanged)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Returns the files that could not be processed.
     * @return The failures by file, in path order.
     */
    public Map<Path, FileOutcome.Failed> failures() {
        Map<Path, FileOutcome.Failed> failures = new LinkedHashMap<>();
        outcomes.forEach((file, outcome) -> {
            if (outcome instanceof FileOutcome.Failed failed) {
                failures.put(file, failed);
            }
        });
        return failures;
    }

    /**
     * Reports whether any file failed.
     * @return {@code true} if at least one outcome is a failure.
     */
    public boolean hasFailures() {
        return outcomes.values().stream().anyMatch(FileOutcome.Failed.class::isInstance);
    }
}
