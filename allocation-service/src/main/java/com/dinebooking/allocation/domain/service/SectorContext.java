package com.dinebooking.allocation.domain.service;

import com.dinebooking.allocation.domain.availability.ServiceHours;
import com.dinebooking.allocation.domain.availability.TableCapacity;
import com.dinebooking.allocation.domain.model.Restaurant;
import com.dinebooking.allocation.domain.model.Sector;

import java.time.ZoneId;
import java.util.List;

/**
 * Restaurant, sector, tables and service hours that every discovery or commit reads first.
 */
public record SectorContext(Restaurant restaurant,
                            Sector sector,
                            List<TableCapacity> tables,
                            List<ServiceHours> serviceHours) {

    public String restaurantId() {
        return restaurant.getId();
    }

    public String sectorId() {
        return sector.getId();
    }

    public ZoneId zone() {
        return restaurant.zoneId();
    }

    public List<String> tableIds() {
        return tables.stream().map(TableCapacity::tableId).toList();
    }
}
