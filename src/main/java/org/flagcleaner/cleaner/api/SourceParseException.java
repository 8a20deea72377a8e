package org.flagcleaner.cleaner.api;

import org.flagcleaner.cleaner.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when source text cannot be parsed well enough to be rewritten safely.
 */
public class SourceParseException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new exception.
     * @param message The detail message.
     * @param diagnostics The errors reported while parsing.
     */
    public SourceParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the errors reported while parsing.
     * @return The diagnostics, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
