package org.flagcleaner.cleaner.diagnostics;

import org.flagcleaner.cleaner.api.CleanerErrorCode;

/**
 * A single diagnostic message reported while lexing or parsing a source file.
 *
 * @param type The severity of the diagnostic.
 * @param code The code identifying the problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        CleanerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the file from being rewritten. */
        ERROR,
        /** A warning that does not prevent rewriting. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, code);
    }
}
