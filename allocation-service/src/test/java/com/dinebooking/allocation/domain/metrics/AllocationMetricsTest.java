package com.dinebooking.allocation.domain.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationMetricsTest {

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final AllocationMetrics metrics = new AllocationMetrics(registry);

    @Test
    @DisplayName("counters are split by outcome and registered under allocation.*")
    void countersByOutcome() {
        metrics.recordReservationCreated();
        metrics.recordReservationCreated();
        metrics.recordReservationCancelled();
        metrics.recordConflict(AllocationMetrics.NO_CAPACITY);
        metrics.recordConflict(AllocationMetrics.TABLE_LOCKED);
        metrics.recordConflict(AllocationMetrics.TABLE_LOCKED);
        metrics.recordConflict("invalid_input");
        metrics.recordLockTimeout();

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.reservationsCreated()).isEqualTo(2);
        assertThat(snapshot.reservationsCancelled()).isEqualTo(1);
        assertThat(snapshot.noCapacityConflicts()).isEqualTo(1);
        assertThat(snapshot.tableLockedConflicts()).isEqualTo(2);
        assertThat(snapshot.lockTimeouts()).isEqualTo(1);
        assertThat(registry.get("allocation.conflicts").tag("reason", "table_locked").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("p95 stays null until twenty samples exist")
    void p95NeedsEnoughSamples() {
        for (int i = 1; i < AllocationMetrics.MIN_SAMPLES_FOR_P95; i++) {
            metrics.recordAssignmentTime(Duration.ofMillis(i));
        }
        assertThat(metrics.snapshot().assignmentTime().samples()).isEqualTo(19);
        assertThat(metrics.snapshot().assignmentTime().p95Millis()).isNull();

        metrics.recordAssignmentTime(Duration.ofMillis(20));

        MetricsSnapshot.Timing timing = metrics.snapshot().assignmentTime();
        assertThat(timing.samples()).isEqualTo(20);
        assertThat(timing.p95Millis()).isNotNull().isBetween(15.0, 25.0);
        assertThat(metrics.snapshot().lockWait().p95Millis()).isNull();
    }
}
