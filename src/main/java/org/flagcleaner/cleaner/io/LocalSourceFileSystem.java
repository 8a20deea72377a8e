package org.flagcleaner.cleaner.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * {@link ISourceFileSystem} backed by the local disk.
 * Writes go to a temporary sibling file that is then moved over the target with {@code ATOMIC_MOVE}.
 */
public class LocalSourceFileSystem implements ISourceFileSystem {

    private static final Logger LOG = LoggerFactory.getLogger(LocalSourceFileSystem.class);

    @Override
    public boolean exists(Path file) {
        return Files.isRegularFile(file);
    }

    @Override
    public String readString(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Override
    public void writeAtomically(Path file, String content) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path parentDir = absolute.getParent();
        // Suffix .UUID.tmp keeps the temp file in the same directory, hence on the same file store.
        Path tempFile = parentDir.resolve(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tempFile, content, StandardCharsets.UTF_8);

        try {
            Files.move(tempFile, absolute, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                LOG.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }

    @Override
    public void delete(Path file) throws IOException {
        Files.delete(file);
    }
}
