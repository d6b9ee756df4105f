package com.dinebooking.allocation.domain.lock;

import com.dinebooking.allocation.domain.metrics.AllocationMetrics;
import com.dinebooking.allocation.exception.TableLockedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-process lock table with a FIFO wait queue per key.
 *
 * <p>Every mutation of a key's queue (grant, enqueue, hand-over, timeout removal) runs inside
 * {@link ConcurrentMap#compute} for that key, so a waiter is either removed or granted, never
 * both. A waiter that gave up is therefore never handed the lock afterwards. Unrelated keys do
 * not contend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InProcessLockCoordinator implements LockCoordinator {

    private final ConcurrentMap<LockKey, KeyQueue> locks = new ConcurrentHashMap<>();
    private final AllocationMetrics metrics;

    @Override
    public LockHandle acquire(LockKey key, Duration timeout) {
        Waiter waiter = new Waiter();
        locks.compute(key, (k, queue) -> {
            KeyQueue q = queue == null ? new KeyQueue() : queue;
            if (!q.held) {
                q.held = true;
                waiter.grant.complete(null);
            } else {
                q.waiters.addLast(waiter);
            }
            return q;
        });

        if (waiter.grant.isDone()) {
            log.debug("Acquired lock: {}", key);
            return newHandle(key);
        }

        try {
            waiter.grant.get(Math.max(timeout.toNanos(), 0L), TimeUnit.NANOSECONDS);
            log.debug("Acquired lock after wait: {}", key);
            return newHandle(key);
        } catch (TimeoutException e) {
            if (abandon(key, waiter)) {
                metrics.recordLockTimeout();
                log.warn("Timed out after {} ms waiting for lock: {}", timeout.toMillis(), key);
                throw new TableLockedException("Table " + key.tableId() + " is locked by another request", e);
            }
            // handed over between the timeout and the removal; the grant is still ours
            log.debug("Acquired lock at timeout boundary: {}", key);
            return newHandle(key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!abandon(key, waiter)) {
                release(key);
            }
            throw new TableLockedException("Interrupted while waiting for lock on table " + key.tableId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Lock grant failed for " + key, e);
        }
    }

    @Override
    public LockSet acquireAll(Collection<LockKey> keys, Duration timeout) {
        List<LockKey> ordered = keys.stream().distinct().sorted().toList();
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        List<LockHandle> acquired = new ArrayList<>(ordered.size());
        try {
            for (LockKey key : ordered) {
                // past the deadline a free key is still granted; a held one fails at once
                long remaining = Math.max(deadline - System.nanoTime(), 0L);
                acquired.add(acquire(key, Duration.ofNanos(remaining)));
            }
            metrics.recordLockWait(Duration.ofNanos(System.nanoTime() - startedAt));
            return new LockSet(acquired);
        } catch (RuntimeException e) {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).close();
            }
            throw e;
        }
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int activeKeyCount() {
        return locks.size();
    }

    public boolean isHeld(LockKey key) {
        boolean[] held = {false};
        locks.computeIfPresent(key, (k, queue) -> {
            held[0] = queue.held;
            return queue;
        });
        return held[0];
    }

    int queueLength(LockKey key) {
        int[] length = {0};
        locks.computeIfPresent(key, (k, queue) -> {
            length[0] = queue.waiters.size();
            return queue;
        });
        return length[0];
    }

    private LockHandle newHandle(LockKey key) {
        return new LockHandle(key, this::release);
    }

    private void release(LockKey key) {
        locks.computeIfPresent(key, (k, queue) -> {
            Waiter next = queue.waiters.pollFirst();
            if (next == null) {
                return null;
            }
            next.grant.complete(null);
            return queue;
        });
        log.debug("Released lock: {}", key);
    }

    /**
     * @return true when the waiter was still queued and has been removed
     */
    private boolean abandon(LockKey key, Waiter waiter) {
        boolean[] removed = {false};
        locks.computeIfPresent(key, (k, queue) -> {
            removed[0] = queue.waiters.remove(waiter);
            return queue;
        });
        return removed[0];
    }

    private static final class KeyQueue {
        private boolean held;
        private final Deque<Waiter> waiters = new ArrayDeque<>();
    }

    private static final class Waiter {
        private final CompletableFuture<Void> grant = new CompletableFuture<>();
    }
}
