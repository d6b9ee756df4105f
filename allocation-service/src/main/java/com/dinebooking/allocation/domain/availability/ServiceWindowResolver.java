package com.dinebooking.allocation.domain.availability;

import com.dinebooking.allocation.exception.InvalidInputException;
import com.dinebooking.allocation.exception.OutsideServiceWindowException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns local {@code HH:mm} windows into UTC intervals for one calendar date in the
 * restaurant's time zone.
 */
@Component
public class ServiceWindowResolver {

    static final int MINUTES_PER_DAY = 24 * 60;

    private static final Pattern TIME_OF_DAY = Pattern.compile("^(\\d{2}):(\\d{2})$");

    /**
     * Active windows for a discovery or commit.
     * <ul>
     *   <li>both bounds: the override window {@code [windowStart, windowEnd)}</li>
     *   <li>one bound: service windows clipped by that bound, empty results dropped</li>
     *   <li>no bounds: the service windows, or the whole day when there are none</li>
     * </ul>
     */
    public List<TimeInterval> resolve(LocalDate date, ZoneId zone, List<ServiceHours> serviceHours,
                                      String windowStart, String windowEnd) {
        Integer lower = windowStart == null ? null : parseMinutes(windowStart);
        Integer upper = windowEnd == null ? null : parseMinutes(windowEnd);

        if (lower != null && upper != null) {
            if (upper <= lower) {
                throw new OutsideServiceWindowException(
                        "Window end " + windowEnd + " must be after start " + windowStart);
            }
            return List.of(toInterval(date, zone, lower, upper));
        }

        List<int[]> spans = new ArrayList<>();
        if (serviceHours.isEmpty()) {
            spans.add(new int[] {0, MINUTES_PER_DAY});
        } else {
            for (ServiceHours hours : serviceHours) {
                spans.add(new int[] {parseMinutes(hours.startTime()), parseMinutes(hours.endTime())});
            }
        }

        List<TimeInterval> windows = new ArrayList<>();
        for (int[] span : spans) {
            int start = lower == null ? span[0] : Math.max(span[0], lower);
            int end = upper == null ? span[1] : Math.min(span[1], upper);
            if (start < end) {
                windows.add(toInterval(date, zone, start, end));
            }
        }
        windows.sort(TimeInterval.BY_START);
        return windows;
    }

    /**
     * A supplied window must overlap at least one service window: with both bounds the window
     * itself, with one bound whatever the bound leaves of the service windows. Restaurants
     * without service windows accept any well-formed window.
     */
    public void validateWithinServiceHours(String windowStart, String windowEnd, List<ServiceHours> serviceHours) {
        if (windowStart == null && windowEnd == null) {
            return;
        }
        int reqStart = windowStart == null ? 0 : parseMinutes(windowStart);
        int reqEnd = windowEnd == null ? MINUTES_PER_DAY : parseMinutes(windowEnd);
        if (windowStart != null && windowEnd != null && reqEnd <= reqStart) {
            throw new OutsideServiceWindowException(
                    "Window end " + windowEnd + " must be after start " + windowStart);
        }
        if (serviceHours.isEmpty()) {
            return;
        }
        boolean overlapsAny = serviceHours.stream().anyMatch(hours ->
                reqStart < parseMinutes(hours.endTime()) && parseMinutes(hours.startTime()) < reqEnd);
        if (!overlapsAny) {
            throw new OutsideServiceWindowException("Window "
                    + (windowStart == null ? "" : windowStart) + "-" + (windowEnd == null ? "" : windowEnd)
                    + " does not intersect service hours");
        }
    }

    /**
     * The local calendar day {@code [00:00, 24:00)} as UTC instants.
     */
    public TimeInterval localDay(LocalDate date, ZoneId zone) {
        return toInterval(date, zone, 0, MINUTES_PER_DAY);
    }

    public Instant toInstant(LocalDate date, ZoneId zone, String timeOfDay) {
        return toInstant(date, zone, parseMinutes(timeOfDay));
    }

    /**
     * Minutes since local midnight. Accepts {@code 00:00} through {@code 24:00}.
     */
    public static int parseMinutes(String timeOfDay) {
        if (timeOfDay == null) {
            throw new InvalidInputException("Time of day is required");
        }
        Matcher m = TIME_OF_DAY.matcher(timeOfDay);
        if (!m.matches()) {
            throw new InvalidInputException("Invalid time of day '" + timeOfDay + "', expected HH:mm");
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        if (minutes > 59 || hours > 24 || (hours == 24 && minutes != 0)) {
            throw new InvalidInputException("Invalid time of day '" + timeOfDay + "'");
        }
        return hours * 60 + minutes;
    }

    private TimeInterval toInterval(LocalDate date, ZoneId zone, int startMinutes, int endMinutes) {
        return TimeInterval.of(toInstant(date, zone, startMinutes), toInstant(date, zone, endMinutes));
    }

    private Instant toInstant(LocalDate date, ZoneId zone, int minutesOfDay) {
        if (minutesOfDay == MINUTES_PER_DAY) {
            return date.plusDays(1).atStartOfDay(zone).toInstant();
        }
        return date.atTime(LocalTime.of(minutesOfDay / 60, minutesOfDay % 60)).atZone(zone).toInstant();
    }
}
