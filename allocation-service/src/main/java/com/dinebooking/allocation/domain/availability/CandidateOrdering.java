package com.dinebooking.allocation.domain.availability;

import java.util.Comparator;
import java.util.List;

/**
 * Total order over candidates; the first element is the best allocation.
 * <ol>
 *   <li>any single table beats any combination</li>
 *   <li>singles: earlier start, then smaller table id</li>
 *   <li>combinations: fewer tables, then earlier start, then the sorted id lists compared
 *       element by element</li>
 * </ol>
 */
public final class CandidateOrdering {

    public static final Comparator<Candidate> BEST_FIRST = CandidateOrdering::compare;

    private CandidateOrdering() {
    }

    private static int compare(Candidate a, Candidate b) {
        if (a.isSingle() != b.isSingle()) {
            return a.isSingle() ? -1 : 1;
        }
        if (!a.isSingle()) {
            int bySize = Integer.compare(a.tableIds().size(), b.tableIds().size());
            if (bySize != 0) {
                return bySize;
            }
        }
        int byStart = a.interval().start().compareTo(b.interval().start());
        if (byStart != 0) {
            return byStart;
        }
        return compareIds(a.tableIds(), b.tableIds());
    }

    static int compareIds(List<String> left, List<String> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int c = left.get(i).compareTo(right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
