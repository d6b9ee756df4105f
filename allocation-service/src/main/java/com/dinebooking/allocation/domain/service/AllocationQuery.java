package com.dinebooking.allocation.domain.service;

import java.time.LocalDate;

/**
 * A validated discovery or commit request. Window bounds are optional {@code HH:mm} strings.
 */
public record AllocationQuery(String restaurantId,
                              String sectorId,
                              LocalDate date,
                              int partySize,
                              int durationMinutes,
                              String windowStart,
                              String windowEnd) {
}
