package com.dinebooking.allocation.domain.lock;

import java.time.Duration;
import java.util.Collection;

/**
 * Mutual exclusion over (table, start) slots for concurrent commit attempts.
 */
public interface LockCoordinator {

    /**
     * Waits up to {@code timeout} for exclusive ownership of {@code key}.
     *
     * @throws com.dinebooking.allocation.exception.TableLockedException if the wait times out
     *         or the thread is interrupted
     */
    LockHandle acquire(LockKey key, Duration timeout);

    /**
     * Acquires every key in sorted order under one shared deadline. On failure all locks
     * taken so far are released before the exception propagates.
     */
    LockSet acquireAll(Collection<LockKey> keys, Duration timeout);
}
