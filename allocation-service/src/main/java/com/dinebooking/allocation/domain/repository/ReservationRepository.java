package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.Reservation;
import com.dinebooking.allocation.domain.model.Reservation.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ReservationRepository extends JpaRepository<Reservation, String> {

    /** Reservations of a sector with the given status overlapping {@code [from, to)}. */
    @Query("SELECT r FROM Reservation r WHERE r.sectorId = :sectorId AND r.status = :status "
            + "AND r.startsAt < :to AND r.endsAt > :from ORDER BY r.startsAt, r.id")
    List<Reservation> findOverlapping(@Param("sectorId") String sectorId,
                                      @Param("status") ReservationStatus status,
                                      @Param("from") Instant from,
                                      @Param("to") Instant to);

    /** Narrow read used right before a commit: only the candidate's tables and interval. */
    @Query("SELECT DISTINCT r FROM Reservation r JOIN r.tableIds t WHERE r.sectorId = :sectorId "
            + "AND r.status = :status AND t IN :tableIds AND r.startsAt < :to AND r.endsAt > :from")
    List<Reservation> findOverlappingTables(@Param("sectorId") String sectorId,
                                            @Param("tableIds") Collection<String> tableIds,
                                            @Param("status") ReservationStatus status,
                                            @Param("from") Instant from,
                                            @Param("to") Instant to);

    List<Reservation> findBySectorIdAndStartsAtGreaterThanEqualAndStartsAtLessThanOrderByStartsAtAscIdAsc(
            String sectorId, Instant from, Instant to);
}
