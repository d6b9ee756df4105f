package com.dinebooking.allocation.domain.lock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Identity of one lockable slot: a table at a slot start instant within a restaurant sector.
 * Keys sort by table id, then start, which is the global acquisition order.
 */
public record LockKey(String restaurantId, String sectorId, String tableId, Instant start)
        implements Comparable<LockKey> {

    private static final Comparator<LockKey> ACQUISITION_ORDER = Comparator
            .comparing(LockKey::tableId)
            .thenComparing(LockKey::start)
            .thenComparing(LockKey::restaurantId)
            .thenComparing(LockKey::sectorId);

    /**
     * One key per table for every slot of the grid that {@code [start, end)} touches, the first
     * slot being {@code start} floored to the grid. Two overlapping intervals on the same table
     * therefore always share at least one key.
     */
    public static List<LockKey> covering(String restaurantId, String sectorId, Collection<String> tableIds,
                                         Instant start, Instant end, Duration slot) {
        long slotSeconds = slot.getSeconds();
        if (slotSeconds <= 0) {
            throw new IllegalArgumentException("Slot must be at least one second: " + slot);
        }
        Instant first = Instant.ofEpochSecond(Math.floorDiv(start.getEpochSecond(), slotSeconds) * slotSeconds);
        List<LockKey> keys = new ArrayList<>();
        for (String tableId : tableIds) {
            for (Instant slotStart = first; slotStart.isBefore(end); slotStart = slotStart.plus(slot)) {
                keys.add(new LockKey(restaurantId, sectorId, tableId, slotStart));
            }
        }
        return keys;
    }

    @Override
    public int compareTo(LockKey other) {
        return ACQUISITION_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return restaurantId + "|" + sectorId + "|" + tableId + "|" + start;
    }
}
