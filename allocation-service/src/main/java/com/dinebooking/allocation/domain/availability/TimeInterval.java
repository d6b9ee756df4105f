package com.dinebooking.allocation.domain.availability;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open interval {@code [start, end)} between two UTC instants.
 * Intervals that merely touch ({@code a.end == b.start}) do not overlap.
 */
public record TimeInterval(Instant start, Instant end) {

    public static final Comparator<TimeInterval> BY_START =
            Comparator.comparing(TimeInterval::start).thenComparing(TimeInterval::end);

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
    }

    public static TimeInterval of(Instant start, Instant end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Interval end must be after start: [" + start + ", " + end + ")");
        }
        return new TimeInterval(start, end);
    }

    public static TimeInterval startingAt(Instant start, int minutes) {
        return of(start, start.plus(Duration.ofMinutes(minutes)));
    }

    /** Zero-length marker used as a boundary sentinel while walking a window. */
    static TimeInterval point(Instant at) {
        return new TimeInterval(at, at);
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public Optional<TimeInterval> intersect(TimeInterval other) {
        Instant s = start.isAfter(other.start) ? start : other.start;
        Instant e = end.isBefore(other.end) ? end : other.end;
        return s.isBefore(e) ? Optional.of(new TimeInterval(s, e)) : Optional.empty();
    }

    public boolean lastsAtLeast(int minutes) {
        return Duration.between(start, end).compareTo(Duration.ofMinutes(minutes)) >= 0;
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
