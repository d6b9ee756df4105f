package com.dinebooking.allocation.domain.availability;

/**
 * Seating range of one table as seen by the allocation engine.
 */
public record TableCapacity(String tableId, int minCapacity, int maxCapacity) {

    public TableCapacity {
        if (minCapacity < 0 || maxCapacity < minCapacity) {
            throw new IllegalArgumentException(
                    "Invalid capacity for table " + tableId + ": " + minCapacity + "-" + maxCapacity);
        }
    }

    /**
     * A party of one fits any table that seats at least one person, even when the
     * table's minimum is higher.
     */
    public boolean seats(int partySize) {
        if (partySize == 1) {
            return maxCapacity >= 1;
        }
        return minCapacity <= partySize && partySize <= maxCapacity;
    }
}
