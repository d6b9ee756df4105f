package com.dinebooking.allocation.domain.lock;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Ownership of one {@link LockKey}. Closing releases the lock; further closes are ignored.
 */
public final class LockHandle implements AutoCloseable {

    private final LockKey key;
    private final Consumer<LockKey> releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(LockKey key, Consumer<LockKey> releaser) {
        this.key = key;
        this.releaser = releaser;
    }

    public LockKey getKey() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.accept(key);
        }
    }
}
