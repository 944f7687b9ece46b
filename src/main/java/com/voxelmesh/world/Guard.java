package com.voxelmesh.world;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped access token for a chunk's core data, handed out by {@link CoreLock}.
 * Releasing is the only way to give up access and must happen on every path.
 * A second release is a programming error: it trips an assertion when
 * assertions are enabled and is ignored otherwise.
 */
public final class Guard implements AutoCloseable {

    private final CoreLock lock;
    private final Access access;
    private final AtomicBoolean released = new AtomicBoolean();

    Guard(CoreLock lock, Access access) {
        this.lock = lock;
        this.access = access;
    }

    public Access getAccess() {
        return access;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (!released.compareAndSet(false, true)) {
            assert false : "Guard released twice on " + lock.getOwner();
            return;
        }
        lock.release(access);
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "Guard[" + access + " on " + lock.getOwner() + (isReleased() ? ", released]" : "]");
    }
}
