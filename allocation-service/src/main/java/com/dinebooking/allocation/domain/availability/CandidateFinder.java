package com.dinebooking.allocation.domain.availability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds every single-table and combination candidate for a party from a sector snapshot.
 * Each candidate occupies exactly the requested duration, anchored at the start of its gap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateFinder {

    private final GapFinder gapFinder;
    private final ComboGenerator comboGenerator;
    private final CapacityCalculator capacityCalculator;
    private final CandidateSelector candidateSelector;

    public List<Candidate> findCandidates(SectorSchedule schedule, int partySize, int durationMinutes) {
        if (schedule.tables().isEmpty() || schedule.windows().isEmpty()) {
            return List.of();
        }

        Map<String, List<TimeInterval>> busyByTable = new LinkedHashMap<>();
        for (TableCapacity table : schedule.tables()) {
            busyByTable.put(table.tableId(), schedule.busyFor(table.tableId()));
        }

        List<Candidate> candidates = new ArrayList<>();
        for (TableCapacity table : schedule.tables()) {
            if (!table.seats(partySize)) {
                continue;
            }
            for (TimeInterval gap : gapFinder.findGaps(busyByTable.get(table.tableId()), schedule.windows(),
                    durationMinutes)) {
                candidates.add(Candidate.single(table, TimeInterval.startingAt(gap.start(), durationMinutes)));
            }
        }

        List<List<TableCapacity>> combos = comboGenerator.generate(schedule.tables(), partySize);
        for (List<TableCapacity> combo : combos) {
            List<String> ids = combo.stream().map(TableCapacity::tableId).toList();
            int min = capacityCalculator.minCapacity(combo);
            int max = capacityCalculator.maxCapacity(combo);
            for (TimeInterval gap : gapFinder.findComboGaps(busyByTable, ids, schedule.windows(), durationMinutes)) {
                candidates.add(new Candidate(Candidate.Kind.COMBO, ids,
                        TimeInterval.startingAt(gap.start(), durationMinutes), min, max));
            }
        }

        log.debug("Found {} candidates ({} combinations explored) for party of {} / {} min",
                candidates.size(), combos.size(), partySize, durationMinutes);
        return candidateSelector.rank(candidates);
    }
}
