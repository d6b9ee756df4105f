package com.dinebooking.allocation.domain.metrics;

/**
 * Point-in-time copy of {@link AllocationMetrics}. Percentiles are in milliseconds and null
 * until enough samples exist.
 */
public record MetricsSnapshot(
        long reservationsCreated,
        long reservationsCancelled,
        long noCapacityConflicts,
        long tableLockedConflicts,
        long lockTimeouts,
        Timing assignmentTime,
        Timing lockWait
) {
    public record Timing(Double p95Millis, long samples) {
    }
}
