package org.flagcleaner.cleaner;

import java.nio.file.Path;
import java.util.List;

/**
 * The files found under a root before any of them is cleaned.
 *
 * @param root The scanned directory.
 * @param totalFiles The number of source files with a handled extension.
 * @param matchingFiles The source files mentioning the flag, sorted by path.
 */
public record Discovery(Path root, int totalFiles, List<Path> matchingFiles) {

    public Discovery {
        matchingFiles = List.copyOf(matchingFiles);
    }
}
