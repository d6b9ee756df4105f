package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.Sector;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SectorRepository extends JpaRepository<Sector, String> {
    Optional<Sector> findByIdAndRestaurantId(String id, String restaurantId);
}
