package com.dinebooking.allocation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZoneId;

@Entity
@Table(name = "restaurants")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Restaurant {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    /** IANA zone id, e.g. America/Argentina/Buenos_Aires. */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }
}
