package com.dinebooking.allocation.api.dto;

import com.dinebooking.allocation.domain.model.Blackout.BlackoutReason;
import com.dinebooking.common.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * An empty or missing table list blacks out the whole sector.
 */
public record CreateBlackoutRequest(
        @NotBlank String restaurantId,
        @NotBlank String sectorId,
        List<String> tableIds,
        @NotBlank @Pattern(regexp = Constants.DATE_PATTERN) String date,
        @NotBlank @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String startTime,
        @NotBlank @Pattern(regexp = Constants.TIME_OF_DAY_PATTERN) String endTime,
        @NotNull BlackoutReason reason,
        @Size(max = 500) String notes
) {}
