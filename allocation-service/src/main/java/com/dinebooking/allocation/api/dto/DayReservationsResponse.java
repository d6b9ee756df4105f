package com.dinebooking.allocation.api.dto;

import java.util.List;

public record DayReservationsResponse(
        String date,
        List<ReservationResponse> items
) {}
