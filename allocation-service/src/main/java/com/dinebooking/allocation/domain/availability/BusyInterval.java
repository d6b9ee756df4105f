package com.dinebooking.allocation.domain.availability;

import java.util.List;

/**
 * A span during which the listed tables cannot be allocated: a confirmed
 * reservation or a blackout. Sector-wide blackouts arrive here already expanded
 * to the sector's tables.
 */
public record BusyInterval(List<String> tableIds, TimeInterval interval, Kind kind) {

    public enum Kind {
        BOOKING,
        BLACKOUT
    }

    public BusyInterval {
        tableIds = List.copyOf(tableIds);
    }

    public boolean occupies(String tableId) {
        return tableIds.contains(tableId);
    }
}
