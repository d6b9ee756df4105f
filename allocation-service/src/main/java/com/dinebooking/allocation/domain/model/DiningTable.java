package com.dinebooking.allocation.domain.model;

import com.dinebooking.allocation.domain.availability.TableCapacity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A seatable table. Capacity bounds satisfy {@code maxCapacity >= minCapacity >= 0}.
 */
@Entity
@Table(name = "dining_tables", indexes = {
        @Index(name = "idx_dining_tables_sector", columnList = "sector_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiningTable {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "sector_id", nullable = false, length = 64)
    private String sectorId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "min_capacity", nullable = false)
    private Integer minCapacity;

    @Column(name = "max_capacity", nullable = false)
    private Integer maxCapacity;

    public TableCapacity toCapacity() {
        return new TableCapacity(id, minCapacity, maxCapacity);
    }
}
