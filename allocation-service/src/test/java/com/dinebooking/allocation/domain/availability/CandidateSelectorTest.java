package com.dinebooking.allocation.domain.availability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSelectorTest {

    private static final Instant BASE = Instant.parse("2030-03-15T23:00:00Z");

    private final CandidateSelector selector = new CandidateSelector();

    private static Candidate single(String table, int startOffsetMinutes) {
        return Candidate.single(new TableCapacity(table, 2, 4),
                TimeInterval.startingAt(BASE.plusSeconds(startOffsetMinutes * 60L), 60));
    }

    private static Candidate combo(int startOffsetMinutes, String... tables) {
        return new Candidate(Candidate.Kind.COMBO, List.of(tables),
                TimeInterval.startingAt(BASE.plusSeconds(startOffsetMinutes * 60L), 60), 4, 8);
    }

    @Test
    @DisplayName("any single beats any combination, even a later one")
    void singleBeatsCombo() {
        Candidate lateSingle = single("T9", 120);
        Candidate earlyCombo = combo(0, "T1", "T2");

        assertThat(selector.select(List.of(earlyCombo, lateSingle))).contains(lateSingle);
    }

    @Test
    @DisplayName("singles: earlier start wins, then smaller table id")
    void singleOrdering() {
        Candidate t2Early = single("T2", 0);
        Candidate t1Early = single("T1", 0);
        Candidate t1Late = single("T1", 15);

        assertThat(selector.rank(List.of(t1Late, t2Early, t1Early))).containsExactly(t1Early, t2Early, t1Late);
    }

    @Test
    @DisplayName("combinations: fewer tables, then earlier start, then smallest ids")
    void comboOrdering() {
        Candidate threeEarly = combo(0, "T1", "T2", "T3");
        Candidate twoLate = combo(30, "T1", "T2");
        Candidate twoEarlyT2 = combo(0, "T2", "T4");
        Candidate twoEarlyT1 = combo(0, "T1", "T4");

        assertThat(selector.rank(List.of(threeEarly, twoLate, twoEarlyT2, twoEarlyT1)))
                .containsExactly(twoEarlyT1, twoEarlyT2, twoLate, threeEarly);
    }

    @Test
    @DisplayName("selection does not depend on input order")
    void selectionIsOrderIndependent() {
        List<Candidate> candidates = new ArrayList<>(List.of(
                combo(0, "T1", "T4"), combo(0, "T2", "T3"), combo(15, "T1", "T4"),
                combo(0, "T1", "T2", "T5"), single("T3", 45), single("T2", 45), single("T5", 60)));
        Candidate expected = single("T2", 45);
        Random random = new Random(7);

        for (int i = 0; i < 50; i++) {
            Collections.shuffle(candidates, random);
            assertThat(selector.select(candidates)).contains(expected);
            assertThat(selector.select(candidates)).isEqualTo(selector.select(List.copyOf(candidates)));
        }
    }

    @Test
    @DisplayName("no candidates selects nothing")
    void emptyInput() {
        assertThat(selector.select(List.of())).isEmpty();
    }
}
