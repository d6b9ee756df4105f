package com.dinebooking.allocation.domain.model;

import com.dinebooking.allocation.domain.availability.ServiceHours;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "service_windows", indexes = {
        @Index(name = "idx_service_windows_restaurant", columnList = "restaurant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    /** Local time of day, HH:mm. */
    @Column(name = "start_time", nullable = false, length = 5)
    private String startTime;

    /** Local time of day, HH:mm; 24:00 closes at midnight. */
    @Column(name = "end_time", nullable = false, length = 5)
    private String endTime;

    public ServiceHours toServiceHours() {
        return new ServiceHours(startTime, endTime);
    }
}
