package com.dinebooking.allocation.domain.repository;

import com.dinebooking.allocation.domain.model.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RestaurantRepository extends JpaRepository<Restaurant, String> {
}
