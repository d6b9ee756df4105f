package com.dinebooking.allocation.api.dto;

import java.util.List;

public record CreateBlackoutResponse(
        BlackoutResponse blackout,
        List<String> cancelledReservationIds
) {}
