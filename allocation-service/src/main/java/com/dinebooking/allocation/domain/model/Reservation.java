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
 * A committed allocation of one or more tables over {@code [startsAt, endsAt)}.
 * Rows are never deleted; the only status change is CONFIRMED to CANCELLED.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_sector_start", columnList = "sector_id, starts_at"),
        @Index(name = "idx_reservations_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @Column(name = "id", length = 32)
    private String id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    @Column(name = "sector_id", nullable = false, length = 64)
    private String sectorId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reservation_tables", joinColumns = @JoinColumn(name = "reservation_id"))
    @Column(name = "table_id", nullable = false, length = 64)
    @OrderColumn(name = "table_order")
    private List<String> tableIds = new ArrayList<>();

    @Column(name = "party_size", nullable = false)
    private Integer partySize;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = ReservationStatus.CONFIRMED;
        }
    }

    /**
     * @return false when the reservation was already cancelled
     */
    public boolean cancel(Instant at) {
        if (status == ReservationStatus.CANCELLED) {
            return false;
        }
        status = ReservationStatus.CANCELLED;
        updatedAt = at;
        return true;
    }

    public enum ReservationStatus {
        CONFIRMED,
        CANCELLED
    }
}
