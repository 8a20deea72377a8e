package org.flagcleaner.cleaner.objc;

import org.flagcleaner.cleaner.ISourceCleaner;
import org.flagcleaner.cleaner.api.FailureKind;
import org.flagcleaner.cleaner.api.FileOutcome;
import org.flagcleaner.cleaner.io.ISourceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans Objective-C files with text substitution instead of parsing.
 * <p>
 * Each {@code #if FLAG} block, then each {@code #ifdef FLAG} block, is replaced by the body of its
 * first branch. {@code #elif} and {@code #else} branches are dropped. Blocks are not nested-aware:
 * the first {@code #endif} after the directive closes the match.
 */
public class ObjcSourceCleaner implements ISourceCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(ObjcSourceCleaner.class);
    private static final String BLOCK_TEMPLATE =
            "(?d)(%s %s\\b.*\\n)([\\s\\S]*?)(#elif.*\\n[\\s\\S]*?)?(#else.*\\n[\\s\\S]*?)?(#endif.*\\n?)";

    private final ISourceFileSystem fileSystem;
    private final List<Pattern> patterns;

    /**
     * Creates a cleaner for one flag.
     * @param fileSystem The file system to read and write through.
     * @param targetFlag The flag to resolve as enabled.
     */
    public ObjcSourceCleaner(ISourceFileSystem fileSystem, String targetFlag) {
        this.fileSystem = fileSystem;
        this.patterns = List.of(blockPattern("#if", targetFlag), blockPattern("#ifdef", targetFlag));
    }

    @Override
    public FileOutcome processFile(Path file) {
        if (!fileSystem.exists(file)) {
            LOG.warn("File not found: {}", file);
            return new FileOutcome.Failed(FailureKind.FILE_NOT_FOUND, "File not found: " + file);
        }
        LOG.debug("Processing Objective-C file {}", file);

        String original;
        try {
            original = fileSystem.readString(file);
        } catch (IOException e) {
            LOG.warn("Failed to read {}", file, e);
            return new FileOutcome.Failed(FailureKind.READ_FAILURE, ISourceCleaner.describe(e));
        }

        String cleaned = clean(original);
        if (cleaned.equals(original)) {
            LOG.debug("No changes made to {}", file);
            return FileOutcome.UNCHANGED;
        }

        if (Thread.currentThread().isInterrupted()) {
            return ISourceCleaner.interruptedBeforeChange(file);
        }

        try {
            fileSystem.writeAtomically(file, cleaned);
        } catch (IOException e) {
            LOG.error("Failed to write {}", file, e);
            return new FileOutcome.Failed(FailureKind.WRITE_FAILURE, ISourceCleaner.describe(e));
        }
        LOG.debug("Cleaned {}", file);
        return FileOutcome.WRITTEN;
    }

    /**
     * Applies the {@code #if} and {@code #ifdef} substitutions to a text.
     * @param source The Objective-C source.
     * @return The cleaned source; equal to the input if no block matched.
     */
    public String clean(String source) {
        String result = source;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(result);
            result = matcher.replaceAll(match -> Matcher.quoteReplacement(match.group(2)));
        }
        return result;
    }

    private static Pattern blockPattern(String directive, String flag) {
        return Pattern.compile(String.format(BLOCK_TEMPLATE, directive, Pattern.quote(flag)));
    }
}
