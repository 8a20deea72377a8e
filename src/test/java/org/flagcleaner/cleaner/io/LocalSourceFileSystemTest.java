package org.flagcleaner.cleaner.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link LocalSourceFileSystem} on a temporary directory.
 */
public class LocalSourceFileSystemTest {

    private final LocalSourceFileSystem fileSystem = new LocalSourceFileSystem();

    @TempDir
    Path dir;

    @Test
    @Tag("integration")
    void testWriteAtomicallyReplacesContentsWithoutLeftovers() throws IOException {
        // Arrange
        Path file = dir.resolve("Feature.swift");
        Files.writeString(file, "old");

        // Act
        fileSystem.writeAtomically(file, "new contents é");

        // Assert
        assertThat(fileSystem.readString(file)).isEqualTo("new contents é");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    @Tag("integration")
    void testExistsOnlyForRegularFiles() throws IOException {
        // Arrange
        Path file = Files.writeString(dir.resolve("A.swift"), "");

        // Act & Assert
        assertThat(fileSystem.exists(file)).isTrue();
        assertThat(fileSystem.exists(dir)).isFalse();
        assertThat(fileSystem.exists(dir.resolve("Missing.swift"))).isFalse();
    }

    @Test
    @Tag("integration")
    void testDelete() throws IOException {
        // Arrange
        Path file = Files.writeString(dir.resolve("A.swift"), "");

        // Act
        fileSystem.delete(file);

        // Assert
        assertThat(file).doesNotExist();
        assertThatThrownBy(() -> fileSystem.delete(file)).isInstanceOf(IOException.class);
    }

    @Test
    @Tag("integration")
    void testReadRejectsInvalidUtf8() throws IOException {
        // Arrange
        Path file = Files.write(dir.resolve("Latin1.m"), new byte[] {(byte) 0xC3, (byte) 0x28});

        // Act & Assert
        assertThatThrownBy(() -> fileSystem.readString(file)).isInstanceOf(IOException.class);
    }
}
