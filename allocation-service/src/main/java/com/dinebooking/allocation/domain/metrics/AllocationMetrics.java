package com.dinebooking.allocation.domain.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process counters and timers for the commit path, registered with Micrometer so they also
 * show up under {@code /actuator/metrics}.
 */
@Component
public class AllocationMetrics {

    public static final String NO_CAPACITY = "no_capacity";
    public static final String TABLE_LOCKED = "table_locked";

    /** Below this many samples a p95 is not reported. */
    static final int MIN_SAMPLES_FOR_P95 = 20;

    private static final double P95 = 0.95;

    private final Counter reservationsCreated;
    private final Counter reservationsCancelled;
    private final Counter noCapacityConflicts;
    private final Counter tableLockedConflicts;
    private final Counter lockTimeouts;
    private final Timer assignmentTime;
    private final Timer lockWaitTime;

    public AllocationMetrics(MeterRegistry meterRegistry) {
        this.reservationsCreated = Counter.builder("allocation.reservations.created")
                .description("Reservations confirmed")
                .register(meterRegistry);
        this.reservationsCancelled = Counter.builder("allocation.reservations.cancelled")
                .description("Reservations cancelled through the API")
                .register(meterRegistry);
        this.noCapacityConflicts = Counter.builder("allocation.conflicts")
                .tag("reason", NO_CAPACITY)
                .description("Commits rejected because nothing could seat the party")
                .register(meterRegistry);
        this.tableLockedConflicts = Counter.builder("allocation.conflicts")
                .tag("reason", TABLE_LOCKED)
                .description("Commits rejected because a table stayed locked")
                .register(meterRegistry);
        this.lockTimeouts = Counter.builder("allocation.lock.timeouts")
                .description("Lock waits that ran out of time")
                .register(meterRegistry);
        this.assignmentTime = Timer.builder("allocation.assignment.duration")
                .description("Time from candidate search to a persisted reservation")
                .publishPercentiles(P95)
                .register(meterRegistry);
        this.lockWaitTime = Timer.builder("allocation.lock.wait")
                .description("Time spent acquiring all locks of one commit")
                .publishPercentiles(P95)
                .register(meterRegistry);
    }

    public void recordReservationCreated() {
        reservationsCreated.increment();
    }

    public void recordReservationCancelled() {
        reservationsCancelled.increment();
    }

    public void recordConflict(String errorCode) {
        if (NO_CAPACITY.equals(errorCode)) {
            noCapacityConflicts.increment();
        } else if (TABLE_LOCKED.equals(errorCode)) {
            tableLockedConflicts.increment();
        }
    }

    public void recordLockTimeout() {
        lockTimeouts.increment();
    }

    public void recordAssignmentTime(Duration elapsed) {
        assignmentTime.record(elapsed);
    }

    public void recordLockWait(Duration elapsed) {
        lockWaitTime.record(elapsed);
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                (long) reservationsCreated.count(),
                (long) reservationsCancelled.count(),
                (long) noCapacityConflicts.count(),
                (long) tableLockedConflicts.count(),
                (long) lockTimeouts.count(),
                timing(assignmentTime),
                timing(lockWaitTime));
    }

    private static MetricsSnapshot.Timing timing(Timer timer) {
        HistogramSnapshot histogram = timer.takeSnapshot();
        long samples = histogram.count();
        Double p95 = null;
        if (samples >= MIN_SAMPLES_FOR_P95) {
            for (ValueAtPercentile value : histogram.percentileValues()) {
                if (value.percentile() == P95) {
                    p95 = value.value(TimeUnit.MILLISECONDS);
                }
            }
        }
        return new MetricsSnapshot.Timing(p95, samples);
    }
}
