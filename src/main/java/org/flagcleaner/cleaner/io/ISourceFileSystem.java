package org.flagcleaner.cleaner.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file operations the cleaners need. Implementations must make writes atomic, so that a reader
 * sees either the old or the new contents, never a partial file.
 */
public interface ISourceFileSystem {

    /**
     * Checks whether a regular file exists.
     * @param file The file to check.
     * @return {@code true} if the file exists.
     */
    boolean exists(Path file);

    /**
     * Reads a file as UTF-8 text.
     * @param file The file to read.
     * @return The file contents.
     * @throws IOException if the file cannot be read or is not valid UTF-8.
     */
    String readString(Path file) throws IOException;

    /**
     * Replaces the contents of a file atomically.
     * @param file The file to write.
     * @param content The new contents, encoded as UTF-8.
     * @throws IOException if the file cannot be written.
     */
    void writeAtomically(Path file, String content) throws IOException;

    /**
     * Deletes a file.
     * @param file The file to delete.
     * @throws IOException if the file cannot be deleted.
     */
    void delete(Path file) throws IOException;
}
