package com.dinebooking.allocation.api.dto;

import com.dinebooking.allocation.domain.model.Reservation;

import java.time.Instant;
import java.util.List;

public record ReservationResponse(
        String id,
        String restaurantId,
        String sectorId,
        List<String> tableIds,
        Integer partySize,
        Instant start,
        Instant end,
        Integer durationMinutes,
        String status,
        Instant createdAt,
        Instant updatedAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getRestaurantId(),
                reservation.getSectorId(),
                List.copyOf(reservation.getTableIds()),
                reservation.getPartySize(),
                reservation.getStartsAt(),
                reservation.getEndsAt(),
                reservation.getDurationMinutes(),
                reservation.getStatus().name(),
                reservation.getCreatedAt(),
                reservation.getUpdatedAt()
        );
    }
}
