package com.raditha.codetwin.model;

import java.util.Comparator;

/**
 * Jaccard score of one file from collection A against one file from
 * collection B.
 *
 * @param fileA         path in collection A
 * @param fileB         path in collection B
 * @param jaccard       similarity in [0, 1]
 * @param fingerprintsA fingerprint count of the A file
 * @param fingerprintsB fingerprint count of the B file
 * @param tokensA       canonical length of the A file
 * @param tokensB       canonical length of the B file
 */
public record PairwiseResult(
        String fileA,
        String fileB,
        double jaccard,
        int fingerprintsA,
        int fingerprintsB,
        int tokensA,
        int tokensB) {

    /**
     * Highest similarity first, ties broken by path so the order is stable.
     */
    public static final Comparator<PairwiseResult> BY_SIMILARITY = Comparator
            .comparingDouble(PairwiseResult::jaccard).reversed()
            .thenComparing(PairwiseResult::fileA)
            .thenComparing(PairwiseResult::fileB);

    public PairwiseResult {
        if (jaccard < 0.0 || jaccard > 1.0) {
            throw new IllegalArgumentException("jaccard must be between 0.0 and 1.0, got " + jaccard);
        }
    }

    /**
     * Similarity as a percentage rounded to two decimals.
     */
    public double similarityPercent() {
        return Math.round(jaccard * 10000.0) / 100.0;
    }
}
