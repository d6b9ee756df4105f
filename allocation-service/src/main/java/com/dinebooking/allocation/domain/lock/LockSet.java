package com.dinebooking.allocation.domain.lock;

import java.util.List;

/**
 * Locks acquired together in acquisition order. Closing releases them in reverse order.
 */
public final class LockSet implements AutoCloseable {

    private final List<LockHandle> handles;

    LockSet(List<LockHandle> handles) {
        this.handles = List.copyOf(handles);
    }

    public List<LockKey> keys() {
        return handles.stream().map(LockHandle::getKey).toList();
    }

    @Override
    public void close() {
        for (int i = handles.size() - 1; i >= 0; i--) {
            handles.get(i).close();
        }
    }
}
