package com.dinebooking.allocation.domain.availability;

import java.util.List;

/**
 * Point-in-time snapshot of one sector for one service day: its tables, the
 * busy intervals touching that day, and the windows during which seating is allowed.
 * Everything the engine decides is a pure function of this snapshot.
 */
public record SectorSchedule(List<TableCapacity> tables,
                             List<BusyInterval> busyIntervals,
                             List<TimeInterval> windows) {

    public SectorSchedule {
        tables = List.copyOf(tables);
        busyIntervals = List.copyOf(busyIntervals);
        windows = List.copyOf(windows);
    }

    public List<TimeInterval> busyFor(String tableId) {
        return busyIntervals.stream()
                .filter(b -> b.occupies(tableId))
                .map(BusyInterval::interval)
                .toList();
    }
}
