package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.domain.availability.BusyInterval;
import com.dinebooking.allocation.domain.availability.TimeInterval;
import com.dinebooking.allocation.domain.model.Blackout;
import com.dinebooking.allocation.domain.model.DiningTable;
import com.dinebooking.allocation.domain.model.Reservation;
import com.dinebooking.allocation.domain.model.Reservation.ReservationStatus;
import com.dinebooking.allocation.domain.model.Restaurant;
import com.dinebooking.allocation.domain.model.Sector;
import com.dinebooking.allocation.domain.model.ServiceWindow;
import com.dinebooking.allocation.domain.repository.BlackoutRepository;
import com.dinebooking.allocation.domain.repository.DiningTableRepository;
import com.dinebooking.allocation.domain.repository.ReservationRepository;
import com.dinebooking.allocation.domain.repository.RestaurantRepository;
import com.dinebooking.allocation.domain.repository.SectorRepository;
import com.dinebooking.allocation.domain.repository.ServiceWindowRepository;
import com.dinebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads the persistent state the allocation engine works on and converts it to engine types.
 * Sector-wide blackouts are expanded to every table of the sector here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectorScheduleLoader {

    private final RestaurantRepository restaurantRepository;
    private final SectorRepository sectorRepository;
    private final DiningTableRepository tableRepository;
    private final ServiceWindowRepository serviceWindowRepository;
    private final ReservationRepository reservationRepository;
    private final BlackoutRepository blackoutRepository;

    public SectorContext loadContext(String restaurantId, String sectorId) {
        Restaurant restaurant = loadRestaurant(restaurantId);
        Sector sector = sectorRepository.findByIdAndRestaurantId(sectorId, restaurantId)
                .orElseThrow(() -> new ResourceNotFoundException("Sector", sectorId));
        return new SectorContext(
                restaurant,
                sector,
                tableRepository.findBySectorIdOrderByIdAsc(sectorId).stream()
                        .map(DiningTable::toCapacity)
                        .toList(),
                serviceWindowRepository.findByRestaurantIdOrderByStartTimeAsc(restaurantId).stream()
                        .map(ServiceWindow::toServiceHours)
                        .toList());
    }

    public Restaurant loadRestaurant(String restaurantId) {
        Restaurant restaurant = restaurantRepository.findById(restaurantId)
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant", restaurantId));
        try {
            ZoneId.of(restaurant.getTimezone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Restaurant " + restaurantId + " has unknown time zone "
                    + restaurant.getTimezone(), e);
        }
        return restaurant;
    }

    /**
     * Confirmed reservations and blackouts of the sector overlapping {@code range}.
     */
    public List<BusyInterval> loadBusy(SectorContext context, TimeInterval range) {
        List<BusyInterval> busy = new ArrayList<>();
        reservationRepository.findOverlapping(context.sectorId(), ReservationStatus.CONFIRMED,
                        range.start(), range.end())
                .forEach(r -> busy.add(toBusy(r)));
        blackoutRepository.findOverlapping(context.sectorId(), range.start(), range.end())
                .forEach(b -> busy.add(toBusy(b, context.tableIds())));
        log.debug("Loaded {} busy intervals for sector {} in {}", busy.size(), context.sectorId(), range);
        return busy;
    }

    /**
     * Fresh read restricted to {@code tableIds} and {@code interval}, used to re-check a
     * candidate after its locks are held.
     */
    public List<BusyInterval> loadConflicts(SectorContext context, Collection<String> tableIds, TimeInterval interval) {
        List<BusyInterval> conflicts = new ArrayList<>();
        reservationRepository.findOverlappingTables(context.sectorId(), tableIds, ReservationStatus.CONFIRMED,
                        interval.start(), interval.end())
                .forEach(r -> conflicts.add(toBusy(r)));
        blackoutRepository.findOverlapping(context.sectorId(), interval.start(), interval.end()).stream()
                .map(b -> toBusy(b, context.tableIds()))
                .filter(b -> b.tableIds().stream().anyMatch(tableIds::contains))
                .forEach(conflicts::add);
        return conflicts;
    }

    private BusyInterval toBusy(Reservation reservation) {
        return new BusyInterval(reservation.getTableIds(),
                TimeInterval.of(reservation.getStartsAt(), reservation.getEndsAt()),
                BusyInterval.Kind.BOOKING);
    }

    private BusyInterval toBusy(Blackout blackout, List<String> sectorTableIds) {
        List<String> tables = blackout.coversWholeSector() ? sectorTableIds : blackout.getTableIds();
        return new BusyInterval(tables,
                TimeInterval.of(blackout.getStartsAt(), blackout.getEndsAt()),
                BusyInterval.Kind.BLACKOUT);
    }
}
