package com.dinebooking.allocation.domain.availability;

import java.util.List;

/**
 * A proposed allocation: one table (SINGLE) or 2..6 tables (COMBO) over a slot of
 * exactly the requested duration. Table ids are unique and sorted.
 */
public record Candidate(Kind kind, List<String> tableIds, TimeInterval interval,
                        int minCapacity, int maxCapacity) {

    public enum Kind {
        SINGLE,
        COMBO
    }

    public Candidate {
        tableIds = tableIds.stream().sorted().distinct().toList();
        if (kind == Kind.SINGLE && tableIds.size() != 1) {
            throw new IllegalArgumentException("Single candidate needs exactly one table: " + tableIds);
        }
        if (kind == Kind.COMBO && (tableIds.size() < 2 || tableIds.size() > ComboGenerator.MAX_COMBO_SIZE)) {
            throw new IllegalArgumentException("Combo candidate needs 2.." + ComboGenerator.MAX_COMBO_SIZE
                    + " tables: " + tableIds);
        }
    }

    public static Candidate single(TableCapacity table, TimeInterval interval) {
        return new Candidate(Kind.SINGLE, List.of(table.tableId()), interval,
                table.minCapacity(), table.maxCapacity());
    }

    public boolean isSingle() {
        return kind == Kind.SINGLE;
    }
}
