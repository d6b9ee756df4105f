package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.api.dto.DayReservationsResponse;
import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.domain.availability.ServiceWindowResolver;
import com.dinebooking.allocation.domain.availability.TimeInterval;
import com.dinebooking.allocation.domain.repository.ReservationRepository;
import com.dinebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService {

    private final ReservationRepository reservationRepository;
    private final SectorScheduleLoader scheduleLoader;
    private final ServiceWindowResolver windowResolver;

    public ReservationResponse getReservation(String reservationId) {
        return reservationRepository.findById(reservationId)
                .map(ReservationResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    /**
     * Reservations of any status starting on the restaurant's local {@code date}.
     */
    public DayReservationsResponse listDay(String restaurantId, String sectorId, String date) {
        LocalDate day = AvailabilityService.parseDate(date);
        SectorContext context = scheduleLoader.loadContext(restaurantId, sectorId);
        TimeInterval range = windowResolver.localDay(day, context.zone());
        return new DayReservationsResponse(
                day.toString(),
                reservationRepository
                        .findBySectorIdAndStartsAtGreaterThanEqualAndStartsAtLessThanOrderByStartsAtAscIdAsc(
                                sectorId, range.start(), range.end())
                        .stream()
                        .map(ReservationResponse::from)
                        .toList());
    }
}
