package com.dinebooking.allocation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "sectors", indexes = {
        @Index(name = "idx_sectors_restaurant", columnList = "restaurant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sector {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    @Column(name = "name", nullable = false)
    private String name;
}
