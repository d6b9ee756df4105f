package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.api.dto.CandidateResponse;
import com.dinebooking.allocation.api.dto.DiscoveryRequest;
import com.dinebooking.allocation.api.dto.DiscoveryResponse;
import com.dinebooking.allocation.config.AllocationProperties;
import com.dinebooking.allocation.domain.availability.Candidate;
import com.dinebooking.allocation.domain.availability.CandidateFinder;
import com.dinebooking.allocation.domain.availability.SectorSchedule;
import com.dinebooking.allocation.domain.availability.ServiceWindowResolver;
import com.dinebooking.allocation.domain.availability.TimeInterval;
import com.dinebooking.allocation.exception.InvalidInputException;
import com.dinebooking.allocation.exception.NoCapacityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Read side of allocation: validates a request, snapshots the sector and lists candidates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final SectorScheduleLoader scheduleLoader;
    private final ServiceWindowResolver windowResolver;
    private final CandidateFinder candidateFinder;
    private final AllocationProperties properties;

    public DiscoveryResponse discover(DiscoveryRequest request) {
        AllocationQuery query = validate(request.restaurantId(), request.sectorId(), request.date(),
                request.partySize(), request.duration(), request.windowStart(), request.windowEnd());

        SectorContext context = scheduleLoader.loadContext(query.restaurantId(), query.sectorId());
        List<Candidate> candidates = findCandidates(context, query);
        if (candidates.isEmpty()) {
            throw new NoCapacityException("No table or combination can seat " + query.partySize()
                    + " for " + query.durationMinutes() + " minutes on " + query.date());
        }

        int limit = request.limit() == null ? candidates.size() : Math.min(request.limit(), candidates.size());
        return new DiscoveryResponse(
                properties.slotMinutes(),
                query.durationMinutes(),
                candidates.subList(0, limit).stream().map(CandidateResponse::from).toList());
    }

    /**
     * Candidates in best-first order from one snapshot of the sector's day.
     */
    public List<Candidate> findCandidates(SectorContext context, AllocationQuery query) {
        windowResolver.validateWithinServiceHours(query.windowStart(), query.windowEnd(), context.serviceHours());
        if (context.tables().isEmpty()) {
            return List.of();
        }
        List<TimeInterval> windows = windowResolver.resolve(query.date(), context.zone(),
                context.serviceHours(), query.windowStart(), query.windowEnd());
        TimeInterval day = windowResolver.localDay(query.date(), context.zone());

        SectorSchedule schedule = new SectorSchedule(context.tables(), scheduleLoader.loadBusy(context, day), windows);
        return candidateFinder.findCandidates(schedule, query.partySize(), query.durationMinutes());
    }

    /**
     * Rejects malformed input before any repository is touched.
     */
    public AllocationQuery validate(String restaurantId, String sectorId, String date, Integer partySize,
                                    Integer durationMinutes, String windowStart, String windowEnd) {
        if (isBlank(restaurantId) || isBlank(sectorId)) {
            throw new InvalidInputException("restaurantId and sectorId are required");
        }
        if (partySize == null || partySize <= 0) {
            throw new InvalidInputException("Party size must be a positive integer");
        }
        if (durationMinutes == null || durationMinutes % properties.slotMinutes() != 0) {
            throw new InvalidInputException(
                    "Duration must be a multiple of " + properties.slotMinutes() + " minutes");
        }
        if (durationMinutes < properties.minDurationMinutes() || durationMinutes > properties.maxDurationMinutes()) {
            throw new InvalidInputException("Duration must be between " + properties.minDurationMinutes()
                    + " and " + properties.maxDurationMinutes() + " minutes");
        }
        LocalDate parsedDate = parseDate(date);
        if (windowStart != null) {
            ServiceWindowResolver.parseMinutes(windowStart);
        }
        if (windowEnd != null) {
            ServiceWindowResolver.parseMinutes(windowEnd);
        }
        return new AllocationQuery(restaurantId, sectorId, parsedDate, partySize, durationMinutes,
                windowStart, windowEnd);
    }

    static LocalDate parseDate(String date) {
        if (date == null) {
            throw new InvalidInputException("Date is required");
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Invalid date '" + date + "', expected YYYY-MM-DD");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
