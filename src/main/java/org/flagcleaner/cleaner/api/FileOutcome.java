package org.flagcleaner.cleaner.api;

/**
 * The terminal state of one processed file. Every processed file ends in exactly one of these.
 */
public sealed interface FileOutcome permits
        FileOutcome.Written,
        FileOutcome.Deleted,
        FileOutcome.Unchanged,
        FileOutcome.Failed {

    /** The shared {@link Written} instance. */
    FileOutcome WRITTEN = new Written();
    /** The shared {@link Deleted} instance. */
    FileOutcome DELETED = new Deleted();
    /** The shared {@link Unchanged} instance. */
    FileOutcome UNCHANGED = new Unchanged();

    /**
     * Reports whether the file on disk was modified.
     * @return {@code true} for written and deleted files.
     */
    default boolean changed() {
        return false;
    }

    /** The cleaned text replaced the file contents. */
    record Written() implements FileOutcome {
        @Override
        public boolean changed() {
            return true;
        }
    }

    /** Nothing meaningful was left, so the file was removed. */
    record Deleted() implements FileOutcome {
        @Override
        public boolean changed() {
            return true;
        }
    }

    /** The file mentions the flag but contains no block on it alone. */
    record Unchanged() implements FileOutcome {
    }

    /**
     * The file could not be processed and is unchanged on disk.
     *
     * @param kind The failure category.
     * @param reason A human-readable description, usually the exception message.
     */
    record Failed(FailureKind kind, String reason) implements FileOutcome {
    }
}
