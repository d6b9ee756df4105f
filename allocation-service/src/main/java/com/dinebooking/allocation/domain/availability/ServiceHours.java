package com.dinebooking.allocation.domain.availability;

/**
 * Local opening span of a restaurant, as {@code HH:mm} strings. {@code 24:00} is end of day.
 */
public record ServiceHours(String startTime, String endTime) {
}
