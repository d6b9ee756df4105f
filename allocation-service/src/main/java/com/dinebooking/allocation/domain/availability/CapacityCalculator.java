package com.dinebooking.allocation.domain.availability;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Additive seating range of a table combination. No seating geometry is modelled.
 */
@Component
public class CapacityCalculator {

    public int minCapacity(List<TableCapacity> tables) {
        return tables.stream().mapToInt(TableCapacity::minCapacity).sum();
    }

    public int maxCapacity(List<TableCapacity> tables) {
        return tables.stream().mapToInt(TableCapacity::maxCapacity).sum();
    }

    public boolean admits(List<TableCapacity> tables, int partySize) {
        return minCapacity(tables) <= partySize && partySize <= maxCapacity(tables);
    }
}
