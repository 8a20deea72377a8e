package org.flagcleaner.cleaner;

import org.flagcleaner.cleaner.io.ISourceFileSystem;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guards the changes made to one file so that a timed-out file is never modified.
 * <p>
 * Reads pass through. The first write or delete commits the file, and {@link #abandon()} only succeeds
 * before that. Once abandoned, every write and delete fails without touching the disk.
 */
final class AbandonableFileSystem implements ISourceFileSystem {

    private enum State { OPEN, COMMITTED, ABANDONED }

    private final ISourceFileSystem delegate;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    AbandonableFileSystem(ISourceFileSystem delegate) {
        this.delegate = delegate;
    }

    /**
     * Gives up on the file unless it is already being changed.
     * @return {@code true} if no change can happen anymore, {@code false} if a change has started.
     */
    boolean abandon() {
        return state.compareAndSet(State.OPEN, State.ABANDONED) || state.get() == State.ABANDONED;
    }

    @Override
    public boolean exists(Path file) {
        return delegate.exists(file);
    }

    @Override
    public String readString(Path file) throws IOException {
        return delegate.readString(file);
    }

    @Override
    public void writeAtomically(Path file, String content) throws IOException {
        commit(file);
        delegate.writeAtomically(file, content);
    }

    @Override
    public void delete(Path file) throws IOException {
        commit(file);
        delegate.delete(file);
    }

    private void commit(Path file) throws InterruptedIOException {
        if (!state.compareAndSet(State.OPEN, State.COMMITTED) && state.get() != State.COMMITTED) {
            throw new InterruptedIOException("Changes to " + file + " were abandoned after the timeout");
        }
    }
}
