package org.flagcleaner.cleaner;

import org.flagcleaner.cleaner.api.FailureKind;
import org.flagcleaner.cleaner.api.FileOutcome;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes one flag from source files of a single language.
 * Implementations never throw for a file; every problem is reported as {@link FileOutcome.Failed}.
 */
public interface ISourceCleaner {

    /**
     * Cleans one file in place.
     * @param file The file to clean.
     * @return The file's terminal state.
     */
    FileOutcome processFile(Path file);

    /**
     * Cleans several files one after the other.
     * @param files The files to clean.
     * @return Each file's outcome, in input order.
     */
    default Map<Path, FileOutcome> processFiles(List<Path> files) {
        Map<Path, FileOutcome> outcomes = new LinkedHashMap<>();
        for (Path file : files) {
            outcomes.put(file, processFile(file));
        }
        return Collections.unmodifiableMap(outcomes);
    }

    /**
     * Reports a file whose worker was interrupted, usually by a timeout, before it changed anything.
     * @param file The file left unchanged.
     * @return A {@link FailureKind#TIMED_OUT} failure.
     */
    static FileOutcome interruptedBeforeChange(Path file) {
        LoggerFactory.getLogger(ISourceCleaner.class).debug("Interrupted before changing {}, leaving it as is", file);
        return new FileOutcome.Failed(FailureKind.TIMED_OUT, "Interrupted before changing the file");
    }

    /**
     * Formats an exception for a {@link FileOutcome.Failed} reason.
     * @param e The exception or error.
     * @return The message, or the exception type if there is none.
     */
    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
