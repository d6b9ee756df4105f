package com.dinebooking.allocation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Declared unavailability of specific tables, or of a whole sector when {@code tableIds} is empty.
 */
@Entity
@Table(name = "blackouts", indexes = {
        @Index(name = "idx_blackouts_restaurant_start", columnList = "restaurant_id, starts_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Blackout {

    @Id
    @Column(name = "id", length = 32)
    private String id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    @Column(name = "sector_id", nullable = false, length = 64)
    private String sectorId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "blackout_tables", joinColumns = @JoinColumn(name = "blackout_id"))
    @Column(name = "table_id", nullable = false, length = 64)
    @OrderColumn(name = "table_order")
    private List<String> tableIds = new ArrayList<>();

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private BlackoutReason reason;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public boolean coversWholeSector() {
        return tableIds == null || tableIds.isEmpty();
    }

    public enum BlackoutReason {
        MAINTENANCE,
        PRIVATE_EVENT,
        STAFF_SHORTAGE,
        OTHER
    }
}
