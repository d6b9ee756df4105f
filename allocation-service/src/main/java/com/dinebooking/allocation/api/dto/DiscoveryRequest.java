package com.dinebooking.allocation.api.dto;

import com.dinebooking.common.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public record DiscoveryRequest(
        @NotBlank String restaurantId,
        @NotBlank String sectorId,
        @NotBlank @Pattern(regexp = Constants.DATE_PATTERN) String date,
        @NotNull @Positive Integer partySize,
        @NotNull @Positive Integer duration,
        @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String windowStart,
        @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String windowEnd,
        @Positive Integer limit
) {}
