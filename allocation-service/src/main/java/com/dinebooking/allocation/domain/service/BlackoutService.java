package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.api.dto.BlackoutResponse;
import com.dinebooking.allocation.api.dto.CreateBlackoutRequest;
import com.dinebooking.allocation.api.dto.CreateBlackoutResponse;
import com.dinebooking.allocation.domain.availability.ServiceWindowResolver;
import com.dinebooking.allocation.domain.availability.TimeInterval;
import com.dinebooking.allocation.domain.model.Blackout;
import com.dinebooking.allocation.domain.model.Reservation;
import com.dinebooking.allocation.domain.model.Reservation.ReservationStatus;
import com.dinebooking.allocation.domain.model.Restaurant;
import com.dinebooking.allocation.domain.repository.BlackoutRepository;
import com.dinebooking.allocation.domain.repository.ReservationRepository;
import com.dinebooking.allocation.exception.InvalidInputException;
import com.dinebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates, lists and removes blackouts. Creating one cancels every confirmed reservation it overlaps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlackoutService {

    private final BlackoutRepository blackoutRepository;
    private final ReservationRepository reservationRepository;
    private final SectorScheduleLoader scheduleLoader;
    private final ServiceWindowResolver windowResolver;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public CreateBlackoutResponse createBlackout(CreateBlackoutRequest request) {
        LocalDate date = AvailabilityService.parseDate(request.date());
        if (request.reason() == null) {
            throw new InvalidInputException("Blackout reason is required");
        }
        SectorContext context = scheduleLoader.loadContext(request.restaurantId(), request.sectorId());

        List<String> tableIds = request.tableIds() == null ? List.of() : request.tableIds().stream().distinct().toList();
        for (String tableId : tableIds) {
            if (!context.tableIds().contains(tableId)) {
                throw new ResourceNotFoundException("Table " + tableId + " not found in sector " + context.sectorId());
            }
        }

        ZoneId zone = context.zone();
        Instant start = windowResolver.toInstant(date, zone, request.startTime());
        Instant end = windowResolver.toInstant(date, zone, request.endTime());
        if (!start.isBefore(end)) {
            throw new InvalidInputException("Blackout end " + request.endTime()
                    + " must be after start " + request.startTime());
        }

        Instant now = clock.instant();
        Blackout blackout = blackoutRepository.save(Blackout.builder()
                .id(idGenerator.blackoutId())
                .restaurantId(context.restaurantId())
                .sectorId(context.sectorId())
                .tableIds(new ArrayList<>(tableIds))
                .startsAt(start)
                .endsAt(end)
                .reason(request.reason())
                .notes(request.notes())
                .createdAt(now)
                .updatedAt(now)
                .build());

        List<String> affectedTables = tableIds.isEmpty() ? context.tableIds() : tableIds;
        List<String> cancelled = cancelOverlapping(context.sectorId(), affectedTables, TimeInterval.of(start, end), now);

        log.info("Blackout {} created on sector {} tables {} [{} - {}), cancelled reservations {}",
                blackout.getId(), context.sectorId(), tableIds.isEmpty() ? "ALL" : tableIds, start, end, cancelled);
        return new CreateBlackoutResponse(BlackoutResponse.from(blackout, zone), cancelled);
    }

    /**
     * Blackouts overlapping the restaurant's local {@code date}, optionally narrowed to one sector.
     */
    @Transactional(readOnly = true)
    public List<BlackoutResponse> listBlackouts(String restaurantId, String sectorId, String date) {
        LocalDate day = AvailabilityService.parseDate(date);
        Restaurant restaurant = scheduleLoader.loadRestaurant(restaurantId);
        ZoneId zone = restaurant.zoneId();
        TimeInterval range = windowResolver.localDay(day, zone);
        List<Blackout> blackouts = sectorId == null || sectorId.isBlank()
                ? blackoutRepository.findByRestaurantOverlapping(restaurantId, range.start(), range.end())
                : blackoutRepository.findOverlapping(sectorId, range.start(), range.end());
        return blackouts.stream()
                .filter(b -> b.getRestaurantId().equals(restaurantId))
                .map(b -> BlackoutResponse.from(b, zone))
                .toList();
    }

    @Transactional
    public void deleteBlackout(String blackoutId) {
        Blackout blackout = blackoutRepository.findById(blackoutId)
                .orElseThrow(() -> new ResourceNotFoundException("Blackout", blackoutId));
        blackoutRepository.delete(blackout);
        log.info("Blackout {} deleted", blackoutId);
    }

    private List<String> cancelOverlapping(String sectorId, List<String> tableIds, TimeInterval interval, Instant now) {
        if (tableIds.isEmpty()) {
            return List.of();
        }
        List<String> cancelled = new ArrayList<>();
        for (Reservation reservation : reservationRepository.findOverlappingTables(sectorId, tableIds,
                ReservationStatus.CONFIRMED, interval.start(), interval.end())) {
            if (reservation.cancel(now)) {
                reservationRepository.save(reservation);
                cancelled.add(reservation.getId());
            }
        }
        return cancelled;
    }
}
