package org.flagcleaner.cleaner.swift;

import org.flagcleaner.cleaner.ISourceCleaner;
import org.flagcleaner.cleaner.api.CleanResult;
import org.flagcleaner.cleaner.api.FailureKind;
import org.flagcleaner.cleaner.api.FileOutcome;
import org.flagcleaner.cleaner.api.FlagCleaner;
import org.flagcleaner.cleaner.api.SourceParseException;
import org.flagcleaner.cleaner.io.ISourceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Cleans Swift files structurally with a {@link FlagCleaner}.
 * <p>
 * A file is read, cleaned and then written back atomically, or deleted when no declaration is left.
 * A file that does not parse is never touched.
 */
public class SwiftSourceCleaner implements ISourceCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(SwiftSourceCleaner.class);

    private final ISourceFileSystem fileSystem;
    private final FlagCleaner flagCleaner;
    private final String targetFlag;

    /**
     * Creates a cleaner for one flag.
     * @param fileSystem The file system to read and write through.
     * @param flagCleaner The text-level cleaner.
     * @param targetFlag The flag to resolve as enabled.
     */
    public SwiftSourceCleaner(ISourceFileSystem fileSystem, FlagCleaner flagCleaner, String targetFlag) {
        this.fileSystem = fileSystem;
        this.flagCleaner = flagCleaner;
        this.targetFlag = targetFlag;
    }

    @Override
    public FileOutcome processFile(Path file) {
        if (!fileSystem.exists(file)) {
            LOG.warn("File not found: {}", file);
            return new FileOutcome.Failed(FailureKind.FILE_NOT_FOUND, "File not found: " + file);
        }
        LOG.debug("Processing Swift file {}", file);

        String source;
        try {
            source = fileSystem.readString(file);
        } catch (IOException e) {
            LOG.warn("Failed to read {}", file, e);
            return new FileOutcome.Failed(FailureKind.READ_FAILURE, ISourceCleaner.describe(e));
        }

        CleanResult result;
        try {
            result = flagCleaner.clean(source, targetFlag, file.toString());
        } catch (SourceParseException e) {
            LOG.warn("Leaving {} untouched, it does not parse: {}", file, e.getMessage());
            String reason = e.getDiagnostics().isEmpty() ? e.getMessage() : e.getDiagnostics().get(0).toString();
            return new FileOutcome.Failed(FailureKind.PARSE_FAILURE, reason);
        }

        if (!result.edited()) {
            LOG.debug("No block on {} alone in {}", targetFlag, file);
            return FileOutcome.UNCHANGED;
        }

        if (Thread.currentThread().isInterrupted()) {
            return ISourceCleaner.interruptedBeforeChange(file);
        }

        if (result.deleteRequested()) {
            try {
                fileSystem.delete(file);
            } catch (IOException e) {
                LOG.error("Failed to delete {}", file, e);
                return new FileOutcome.Failed(FailureKind.DELETE_FAILURE, ISourceCleaner.describe(e));
            }
            LOG.info("Deleted {}: nothing left after removing {}", file, targetFlag);
            return FileOutcome.DELETED;
        }

        try {
            fileSystem.writeAtomically(file, result.newText().orElseThrow());
        } catch (IOException e) {
            LOG.error("Failed to write {}", file, e);
            return new FileOutcome.Failed(FailureKind.WRITE_FAILURE, ISourceCleaner.describe(e));
        }
        LOG.debug("Cleaned {}", file);
        return FileOutcome.WRITTEN;
    }
}
