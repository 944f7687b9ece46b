package com.voxelmesh.world;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking reader/writer lock over a chunk's core data.
 * State: a positive value counts readers, {@code -1} marks a writer, {@code 0} is free.
 * Acquisition never waits; it either succeeds immediately or returns null.
 */
public final class CoreLock {

    private static final int WRITER = -1;

    private final AtomicInteger state = new AtomicInteger();
    private final Object owner;

    public CoreLock(Object owner) {
        this.owner = owner;
    }

    /** Probe whether an acquire would currently succeed. The answer may be stale immediately. */
    public boolean canAcquire(Access access) {
        int current = state.get();
        return access == Access.READ ? current >= 0 : current == 0;
    }

    /** Try to acquire access, returning the guard or null if it is not available right now. */
    public Guard tryAcquire(Access access) {
        if (access == Access.WRITE) {
            return state.compareAndSet(0, WRITER) ? new Guard(this, access) : null;
        }

        while (true) {
            int current = state.get();
            if (current == WRITER) return null;
            if (state.compareAndSet(current, current + 1)) return new Guard(this, access);
        }
    }

    void release(Access access) {
        if (access == Access.WRITE) {
            boolean released = state.compareAndSet(WRITER, 0);
            assert released : "Write access released without being held on " + owner;
            return;
        }

        int remaining = state.decrementAndGet();
        assert remaining >= 0 : "Read access released without being held on " + owner;
    }

    public int getReaderCount() {
        return Math.max(state.get(), 0);
    }

    public boolean isWriteHeld() {
        return state.get() == WRITER;
    }

    Object getOwner() {
        return owner;
    }
}
