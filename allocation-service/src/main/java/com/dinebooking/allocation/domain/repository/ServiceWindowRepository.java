package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.ServiceWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ServiceWindowRepository extends JpaRepository<ServiceWindow, Long> {
    List<ServiceWindow> findByRestaurantIdOrderByStartTimeAsc(String restaurantId);
}
