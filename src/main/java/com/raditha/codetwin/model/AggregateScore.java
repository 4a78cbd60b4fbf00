package com.raditha.codetwin.model;

/**
 * Repo-level similarity of a comparison run.
 *
 * @param score   mean of the two directional scores, in [0, 1]
 * @param aToB    weighted best-match score of A's files against B
 * @param bToA    weighted best-match score of B's files against A
 * @param defined false when either collection had no files; the scores are
 *                then reported as 0.0
 */
public record AggregateScore(double score, double aToB, double bToA, boolean defined) {

    private static final AggregateScore UNDEFINED = new AggregateScore(0.0, 0.0, 0.0, false);

    public static AggregateScore of(double aToB, double bToA) {
        return new AggregateScore((aToB + bToA) / 2.0, aToB, bToA, true);
    }

    public static AggregateScore undefined() {
        return UNDEFINED;
    }

    public double percent() {
        return Math.round(score * 10000.0) / 100.0;
    }
}
