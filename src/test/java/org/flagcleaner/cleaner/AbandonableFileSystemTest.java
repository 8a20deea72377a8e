package org.flagcleaner.cleaner;

import org.flagcleaner.cleaner.io.ISourceFileSystem;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AbandonableFileSystem}, which keeps timed-out files unchanged.
 */
public class AbandonableFileSystemTest {

    private static final Path FILE = Path.of("Feature.swift");

    private final ISourceFileSystem delegate = mock(ISourceFileSystem.class);
    private final AbandonableFileSystem files = new AbandonableFileSystem(delegate);

    @Test
    @Tag("unit")
    void testAbandonedFileRejectsWriteAndDelete() throws IOException {
        // Arrange
        when(delegate.readString(FILE)).thenReturn("let a = 1");

        // Act
        boolean abandoned = files.abandon();

        // Assert
        assertThat(abandoned).isTrue();
        assertThat(files.readString(FILE)).isEqualTo("let a = 1");
        assertThatThrownBy(() -> files.writeAtomically(FILE, "x")).isInstanceOf(InterruptedIOException.class);
        assertThatThrownBy(() -> files.delete(FILE)).isInstanceOf(InterruptedIOException.class);
        verify(delegate, never()).writeAtomically(any(), anyString());
        verify(delegate, never()).delete(any());
    }

    @Test
    @Tag("unit")
    void testCommittedFileCannotBeAbandoned() throws IOException {
        // Act
        files.writeAtomically(FILE, "x");
        boolean abandoned = files.abandon();
        files.delete(FILE);

        // Assert
        assertThat(abandoned).isFalse();
        verify(delegate).writeAtomically(FILE, "x");
        verify(delegate).delete(FILE);
    }
}
