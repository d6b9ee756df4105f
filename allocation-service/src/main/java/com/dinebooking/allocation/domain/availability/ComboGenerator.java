package com.dinebooking.allocation.domain.availability;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Enumerates table subsets of size 2..6 whose combined capacity admits a party size.
 *
 * <p>Bounded backtracking over tables sorted by max capacity (largest first). A subset is
 * recorded as soon as it admits the party and the search keeps extending it; branches whose
 * remaining tables cannot lift the max sum up to the party size are skipped. Larger valid
 * combinations beyond six tables are deliberately never explored.
 */
@Component
public class ComboGenerator {

    public static final int MAX_COMBO_SIZE = 6;

    /**
     * @return combinations with members sorted by table id, in discovery order
     */
    public List<List<TableCapacity>> generate(List<TableCapacity> tables, int partySize) {
        List<TableCapacity> sorted = tables.stream()
                .filter(t -> t.maxCapacity() > 0)
                .sorted(Comparator.comparingInt(TableCapacity::maxCapacity).reversed()
                        .thenComparing(TableCapacity::tableId))
                .toList();

        // suffix sums of max capacity: remainingMax[i] = max sum of sorted[i..]
        int[] remainingMax = new int[sorted.size() + 1];
        for (int i = sorted.size() - 1; i >= 0; i--) {
            remainingMax[i] = remainingMax[i + 1] + sorted.get(i).maxCapacity();
        }

        List<List<TableCapacity>> combos = new ArrayList<>();
        backtrack(sorted, remainingMax, partySize, 0, new ArrayList<>(), 0, 0, combos);
        return combos;
    }

    private void backtrack(List<TableCapacity> sorted, int[] remainingMax, int partySize, int from,
                           List<TableCapacity> current, int minSum, int maxSum,
                           List<List<TableCapacity>> out) {
        if (current.size() >= 2 && minSum <= partySize && partySize <= maxSum) {
            List<TableCapacity> combo = new ArrayList<>(current);
            combo.sort(Comparator.comparing(TableCapacity::tableId));
            out.add(List.copyOf(combo));
        }
        if (current.size() >= MAX_COMBO_SIZE) {
            return;
        }
        for (int i = from; i < sorted.size(); i++) {
            if (maxSum + remainingMax[i] < partySize) {
                // later indices only have less remaining capacity
                return;
            }
            TableCapacity table = sorted.get(i);
            int nextMin = minSum + table.minCapacity();
            if (nextMin > partySize) {
                continue;
            }
            current.add(table);
            backtrack(sorted, remainingMax, partySize, i + 1, current, nextMin,
                    maxSum + table.maxCapacity(), out);
            current.remove(current.size() - 1);
        }
    }
}
