package io.github.chirino.conversations.streaming;

import io.github.chirino.conversations.branch.BranchCoordinate;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/** An assistant message that is still being written by a running generation. */
public final class InFlightGeneration {

    public enum State {
        OPEN,
        CLOSED
    }

    private final String conversationId;
    private final BranchCoordinate branch;
    private final String messageId;
    private final Instant startedAt = Instant.now();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final Object monitor = new Object();

    InFlightGeneration(String conversationId, BranchCoordinate branch, String messageId) {
        this.conversationId = conversationId;
        this.branch = branch;
        this.messageId = messageId;
    }

    public String conversationId() {
        return conversationId;
    }

    public BranchCoordinate branch() {
        return branch;
    }

    public String messageId() {
        return messageId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public boolean isClosed() {
        return state.get() == State.CLOSED;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void requestCancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            signalWaiters();
        }
    }

    /** @return true for the call that actually closed the generation */
    boolean markClosed() {
        if (!state.compareAndSet(State.OPEN, State.CLOSED)) {
            return false;
        }
        signalWaiters();
        return true;
    }

    /** Blocks until the generation is finalized or {@code timeout} elapses. */
    boolean awaitClosed(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (state.get() != State.CLOSED) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    return false;
                }
                try {
                    monitor.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    private void signalWaiters() {
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }
}
