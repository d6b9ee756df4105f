package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.DiningTable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DiningTableRepository extends JpaRepository<DiningTable, String> {
    List<DiningTable> findBySectorIdOrderByIdAsc(String sectorId);
}
