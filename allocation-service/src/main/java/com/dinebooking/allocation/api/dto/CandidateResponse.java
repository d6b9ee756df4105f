package com.dinebooking.allocation.api.dto;

import com.dinebooking.allocation.domain.availability.Candidate;

import java.time.Instant;
import java.util.List;

public record CandidateResponse(
        String kind,
        List<String> tableIds,
        Instant start,
        Instant end,
        int minCapacity,
        int maxCapacity
) {
    public static CandidateResponse from(Candidate candidate) {
        return new CandidateResponse(
                candidate.kind().name().toLowerCase(),
                candidate.tableIds(),
                candidate.interval().start(),
                candidate.interval().end(),
                candidate.minCapacity(),
                candidate.maxCapacity());
    }
}
