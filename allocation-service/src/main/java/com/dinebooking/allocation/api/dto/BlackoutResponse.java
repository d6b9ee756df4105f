package com.dinebooking.allocation.api.dto;

import com.dinebooking.allocation.domain.model.Blackout;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Blackout with both UTC instants and the restaurant's local wall-clock times.
 */
public record BlackoutResponse(
        String id,
        String restaurantId,
        String sectorId,
        List<String> tableIds,
        Instant start,
        Instant end,
        LocalDateTime localStart,
        LocalDateTime localEnd,
        String reason,
        String notes,
        Instant createdAt
) {
    public static BlackoutResponse from(Blackout blackout, ZoneId zone) {
        return new BlackoutResponse(
                blackout.getId(),
                blackout.getRestaurantId(),
                blackout.getSectorId(),
                List.copyOf(blackout.getTableIds()),
                blackout.getStartsAt(),
                blackout.getEndsAt(),
                LocalDateTime.ofInstant(blackout.getStartsAt(), zone),
                LocalDateTime.ofInstant(blackout.getEndsAt(), zone),
                blackout.getReason().name(),
                blackout.getNotes(),
                blackout.getCreatedAt());
    }
}
