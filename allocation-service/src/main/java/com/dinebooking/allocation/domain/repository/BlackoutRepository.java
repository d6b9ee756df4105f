package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.Blackout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface BlackoutRepository extends JpaRepository<Blackout, String> {

    @Query("SELECT b FROM Blackout b WHERE b.sectorId = :sectorId "
            + "AND b.startsAt < :to AND b.endsAt > :from ORDER BY b.startsAt, b.id")
    List<Blackout> findOverlapping(@Param("sectorId") String sectorId,
                                   @Param("from") Instant from,
                                   @Param("to") Instant to);

    @Query("SELECT b FROM Blackout b WHERE b.restaurantId = :restaurantId "
            + "AND b.startsAt < :to AND b.endsAt > :from ORDER BY b.startsAt, b.id")
    List<Blackout> findByRestaurantOverlapping(@Param("restaurantId") String restaurantId,
                                               @Param("from") Instant from,
                                               @Param("to") Instant to);
}
