package org.flagcleaner.cleaner.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Finds the source files a cleanup run should look at.
 * <p>
 * Exclusion patterns are globs matched against single path names, such as {@code *.bundle}.
 * A matching directory is skipped together with everything below it.
 */
public class SourceFileFinder {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFileFinder.class);

    private final Set<String> extensions;
    private final List<PathMatcher> exclusions;
    private final ISourceFileSystem fileSystem;

    /**
     * Creates a finder.
     * @param extensions The file extensions to collect, including the dot (".swift").
     * @param excludedPathPatterns Glob patterns for directory or file names to skip.
     * @param fileSystem The file system used to read candidate files.
     */
    public SourceFileFinder(Collection<String> extensions, Collection<String> excludedPathPatterns,
                            ISourceFileSystem fileSystem) {
        this.extensions = Set.copyOf(extensions);
        this.exclusions = excludedPathPatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.fileSystem = fileSystem;
    }

    /**
     * Collects every file below {@code root} with one of the configured extensions.
     * @param root The directory to scan.
     * @return The matching files, sorted by path.
     * @throws IOException if the directory tree cannot be walked.
     * @throws IllegalArgumentException if {@code root} is not a directory.
     */
    public List<Path> collect(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(dir)) {
                    LOG.debug("Skipping excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && hasSourceExtension(file) && !isExcluded(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warn("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    /**
     * Keeps the files whose text contains {@code flag} literally. Unreadable files are logged and dropped.
     * @param files The candidate files.
     * @param flag The flag name to look for.
     * @return The files mentioning the flag, in input order.
     */
    public List<Path> filterContaining(List<Path> files, String flag) {
        List<Path> matching = new ArrayList<>();
        for (Path file : files) {
            try {
                if (fileSystem.readString(file).contains(flag)) {
                    matching.add(file);
                }
            } catch (IOException e) {
                LOG.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            }
        }
        return matching;
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot));
    }

    private boolean isExcluded(Path path) {
        Path name = path.getFileName();
        return name != null && exclusions.stream().anyMatch(matcher -> matcher.matches(name));
    }
}
