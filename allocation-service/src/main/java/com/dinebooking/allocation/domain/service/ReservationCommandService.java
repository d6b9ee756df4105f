package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.api.dto.CreateReservationRequest;
import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.config.AllocationProperties;
import com.dinebooking.allocation.domain.availability.BusyInterval;
import com.dinebooking.allocation.domain.availability.Candidate;
import com.dinebooking.allocation.domain.availability.CandidateSelector;
import com.dinebooking.allocation.domain.idempotency.IdempotencyClaim;
import com.dinebooking.allocation.domain.idempotency.IdempotencyStore;
import com.dinebooking.allocation.domain.idempotency.PayloadFingerprinter;
import com.dinebooking.allocation.domain.lock.LockCoordinator;
import com.dinebooking.allocation.domain.lock.LockKey;
import com.dinebooking.allocation.domain.lock.LockSet;
import com.dinebooking.allocation.domain.metrics.AllocationMetrics;
import com.dinebooking.allocation.domain.model.Reservation;
import com.dinebooking.allocation.domain.repository.ReservationRepository;
import com.dinebooking.allocation.exception.InvalidInputException;
import com.dinebooking.allocation.exception.NoCapacityException;
import com.dinebooking.allocation.exception.TableLockedException;
import com.dinebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Commits reservations exactly once per idempotency key without double-booking a table.
 *
 * <p>Steps: validate, claim the idempotency key, discover and select a candidate, lock every
 * slot its tables occupy in sorted order, re-read conflicts for those tables, persist. Locks
 * are scoped by try-with-resources and a failed attempt gives its idempotency claim back.
 *
 * <p>{@link #createReservation} is deliberately not transactional: the reservation row must be
 * committed (by the repository's own transaction) before the table locks are released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationCommandService {

    private final AvailabilityService availabilityService;
    private final SectorScheduleLoader scheduleLoader;
    private final CandidateSelector candidateSelector;
    private final LockCoordinator lockCoordinator;
    private final IdempotencyStore idempotencyStore;
    private final PayloadFingerprinter fingerprinter;
    private final ReservationRepository reservationRepository;
    private final IdGenerator idGenerator;
    private final AllocationProperties properties;
    private final AllocationMetrics metrics;
    private final Clock clock;

    public ReservationResponse createReservation(String idempotencyKey, CreateReservationRequest request) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new InvalidInputException("Idempotency-Key header is required");
        }
        AllocationQuery query = availabilityService.validate(request.restaurantId(), request.sectorId(),
                request.date(), request.partySize(), request.durationMinutes(),
                request.windowStart(), request.windowEnd());

        String fingerprint = fingerprinter.fingerprint(request);
        Optional<ReservationResponse> cached = idempotencyStore.find(idempotencyKey, fingerprint);
        if (cached.isPresent()) {
            log.debug("Replaying reservation {} for idempotency key {}", cached.get().id(), idempotencyKey);
            return cached.get();
        }

        IdempotencyClaim claim = idempotencyStore.claim(idempotencyKey, fingerprint);
        if (claim.getReplay().isPresent()) {
            return claim.getReplay().get();
        }

        boolean completed = false;
        try {
            ReservationResponse response = commit(query);
            idempotencyStore.complete(claim, response);
            completed = true;
            return response;
        } finally {
            if (!completed) {
                idempotencyStore.abandon(claim);
            }
        }
    }

    private ReservationResponse commit(AllocationQuery query) {
        long startedAt = System.nanoTime();
        SectorContext context = scheduleLoader.loadContext(query.restaurantId(), query.sectorId());
        List<Candidate> candidates = availabilityService.findCandidates(context, query);
        Optional<Candidate> selected = candidateSelector.select(candidates);
        if (selected.isEmpty()) {
            metrics.recordConflict(AllocationMetrics.NO_CAPACITY);
            throw new NoCapacityException("No table or combination can seat "
                    + query.partySize() + " for " + query.durationMinutes() + " minutes on " + query.date());
        }
        Candidate candidate = selected.get();
        log.debug("Selected {} {} at {} out of {} candidates", candidate.kind(), candidate.tableIds(),
                candidate.interval().start(), candidates.size());

        List<LockKey> keys = LockKey.covering(context.restaurantId(), context.sectorId(), candidate.tableIds(),
                candidate.interval().start(), candidate.interval().end(),
                Duration.ofMinutes(properties.slotMinutes()));

        try (LockSet ignored = acquire(keys)) {
            List<BusyInterval> conflicts = scheduleLoader.loadConflicts(context, candidate.tableIds(),
                    candidate.interval());
            if (!conflicts.isEmpty()) {
                metrics.recordConflict(AllocationMetrics.NO_CAPACITY);
                log.warn("Candidate {} at {} was taken after discovery ({} conflicts)",
                        candidate.tableIds(), candidate.interval().start(), conflicts.size());
                throw new NoCapacityException("Selected tables " + candidate.tableIds()
                        + " are no longer available");
            }
            Reservation saved = reservationRepository.save(newReservation(query, candidate));
            metrics.recordAssignmentTime(Duration.ofNanos(System.nanoTime() - startedAt));
            metrics.recordReservationCreated();
            log.info("Reservation {} confirmed: tables {} at {} for party of {}",
                    saved.getId(), saved.getTableIds(), saved.getStartsAt(), saved.getPartySize());
            return ReservationResponse.from(saved);
        }
    }

    private LockSet acquire(List<LockKey> keys) {
        try {
            return lockCoordinator.acquireAll(keys, properties.lock().timeout());
        } catch (TableLockedException e) {
            metrics.recordConflict(AllocationMetrics.TABLE_LOCKED);
            throw e;
        }
    }

    /**
     * Cancelling an already cancelled reservation is a no-op.
     */
    @Transactional
    public void cancelReservation(String reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        if (reservation.cancel(clock.instant())) {
            reservationRepository.save(reservation);
            metrics.recordReservationCancelled();
            log.info("Reservation {} cancelled", reservationId);
        } else {
            log.debug("Reservation {} already cancelled", reservationId);
        }
    }

    private Reservation newReservation(AllocationQuery query, Candidate candidate) {
        Instant now = clock.instant();
        return Reservation.builder()
                .id(idGenerator.reservationId())
                .restaurantId(query.restaurantId())
                .sectorId(query.sectorId())
                .tableIds(new ArrayList<>(candidate.tableIds()))
                .partySize(query.partySize())
                .startsAt(candidate.interval().start())
                .endsAt(candidate.interval().end())
                .durationMinutes(query.durationMinutes())
                .status(Reservation.ReservationStatus.CONFIRMED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
