package com.dinebooking.allocation.domain.availability;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Computes free intervals for a table (or the intersection across a set of tables)
 * inside the active windows of a day.
 *
 * <p>Both operations are pure and order-independent: the same busy intervals in any
 * order yield the same gaps, sorted by start.
 */
@Component
public class GapFinder {

    /**
     * Free intervals of at least {@code durationMinutes} inside {@code windows}, given the
     * busy intervals of a single table. Busy intervals may overlap one another.
     */
    public List<TimeInterval> findGaps(List<TimeInterval> busy, List<TimeInterval> windows, int durationMinutes) {
        List<TimeInterval> gaps = new ArrayList<>();
        for (TimeInterval window : windows) {
            gaps.addAll(gapsInWindow(busy, window, durationMinutes));
        }
        gaps.sort(TimeInterval.BY_START);
        return gaps;
    }

    /**
     * Gaps shared by every table in {@code tableIds}. Empty as soon as one table has none.
     */
    public List<TimeInterval> findComboGaps(Map<String, List<TimeInterval>> busyByTable,
                                            List<String> tableIds,
                                            List<TimeInterval> windows,
                                            int durationMinutes) {
        List<TimeInterval> shared = null;
        for (String tableId : tableIds) {
            List<TimeInterval> own = findGaps(busyByTable.getOrDefault(tableId, List.of()), windows, durationMinutes);
            if (own.isEmpty()) {
                return List.of();
            }
            shared = shared == null ? own : intersectAll(shared, own);
            if (shared.isEmpty()) {
                return List.of();
            }
        }
        if (shared == null) {
            return List.of();
        }
        return shared.stream()
                .filter(gap -> gap.lastsAtLeast(durationMinutes))
                .sorted(TimeInterval.BY_START)
                .toList();
    }

    private List<TimeInterval> gapsInWindow(List<TimeInterval> busy, TimeInterval window, int durationMinutes) {
        List<TimeInterval> points = new ArrayList<>();
        points.add(TimeInterval.point(window.start()));
        busy.stream()
                .filter(b -> b.overlaps(window))
                .sorted(Comparator.comparing(TimeInterval::start).thenComparing(TimeInterval::end))
                .forEach(points::add);
        points.add(TimeInterval.point(window.end()));

        List<TimeInterval> gaps = new ArrayList<>();
        // furthest end seen so far, so a short interval nested in a long one cannot open a false gap
        Instant prevEnd = window.start();
        for (int i = 1; i < points.size(); i++) {
            TimeInterval next = points.get(i);
            Instant nextStart = next.start().isAfter(window.end()) ? window.end() : next.start();
            if (prevEnd.isBefore(nextStart)) {
                TimeInterval gap = new TimeInterval(prevEnd, nextStart);
                if (gap.lastsAtLeast(durationMinutes)) {
                    gaps.add(gap);
                }
            }
            if (next.end().isAfter(prevEnd)) {
                prevEnd = next.end();
            }
        }
        return gaps;
    }

    private List<TimeInterval> intersectAll(List<TimeInterval> left, List<TimeInterval> right) {
        List<TimeInterval> result = new ArrayList<>();
        for (TimeInterval a : left) {
            for (TimeInterval b : right) {
                a.intersect(b).ifPresent(result::add);
            }
        }
        return result;
    }
}
