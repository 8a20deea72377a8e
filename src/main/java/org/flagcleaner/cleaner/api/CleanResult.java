package org.flagcleaner.cleaner.api;

import java.util.Optional;

/**
 * The result of cleaning one source text.
 *
 * @param edited Whether any conditional block was resolved.
 * @param newText The rewritten text; present only when the file should be written.
 * @param deleteRequested Whether nothing meaningful is left and the file should be deleted.
 */
public record CleanResult(boolean edited, Optional<String> newText, boolean deleteRequested) {

    /**
     * Creates the result for text that needed no change.
     * @return An unedited result.
     */
    public static CleanResult unchanged() {
        return new CleanResult(false, Optional.empty(), false);
    }

    /**
     * Creates the result for text that should replace the original.
     * @param text The rewritten text.
     * @return An edited result carrying the text.
     */
    public static CleanResult rewritten(String text) {
        return new CleanResult(true, Optional.of(text), false);
    }

    /**
     * Creates the result for a file left without content.
     * @return An edited result requesting deletion.
     */
    public static CleanResult delete() {
        return new CleanResult(true, Optional.empty(), true);
    }
}
