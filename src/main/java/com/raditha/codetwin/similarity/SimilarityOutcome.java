package com.raditha.codetwin.similarity;

import com.raditha.codetwin.model.AggregateScore;
import com.raditha.codetwin.model.PairwiseResult;

import java.util.List;

/**
 * Result of scoring two collections against each other.
 *
 * @param pairs     every A x B pair, highest similarity first
 * @param aggregate symmetric repo-level score
 */
public record SimilarityOutcome(List<PairwiseResult> pairs, AggregateScore aggregate) {

    public SimilarityOutcome {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
    }
}
