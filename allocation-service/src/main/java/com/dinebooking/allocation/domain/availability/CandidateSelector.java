package com.dinebooking.allocation.domain.availability;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the best candidate under {@link CandidateOrdering}. The result does not depend on
 * the order in which candidates are supplied.
 */
@Component
public class CandidateSelector {

    public Optional<Candidate> select(List<Candidate> candidates) {
        return candidates.stream().min(CandidateOrdering.BEST_FIRST);
    }

    public List<Candidate> rank(List<Candidate> candidates) {
        return candidates.stream().sorted(CandidateOrdering.BEST_FIRST).toList();
    }
}
