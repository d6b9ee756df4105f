package com.dinebooking.allocation.api.dto;

import java.util.List;

public record DiscoveryResponse(
        int slotMinutes,
        int durationMinutes,
        List<CandidateResponse> candidates
) {}
