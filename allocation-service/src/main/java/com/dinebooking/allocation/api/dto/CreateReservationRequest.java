package com.dinebooking.allocation.api.dto;

import com.dinebooking.common.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Commit request. Its JSON form is what the idempotency fingerprint is computed over.
 */
public record CreateReservationRequest(
        @NotBlank String restaurantId,
        @NotBlank String sectorId,
        @NotNull @Positive Integer partySize,
        @NotNull @Positive Integer durationMinutes,
        @NotBlank @Pattern(regexp = Constants.DATE_PATTERN) String date,
        @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String windowStart,
        @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String windowEnd
) {}
