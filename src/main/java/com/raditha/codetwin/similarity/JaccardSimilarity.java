package com.raditha.codetwin.similarity;

import com.raditha.codetwin.model.FingerprintSet;

/**
 * Calculates set similarity between two fingerprint sets.
 */
public class JaccardSimilarity {

    /**
     * Score used when either set is empty, including when both are.
     * An empty file shares no code with anything.
     */
    public static final double EMPTY_SET_SIMILARITY = 0.0;

    private JaccardSimilarity() {
    }

    /**
     * |x ∩ y| / |x ∪ y|.
     *
     * @return similarity score (0.0 to 1.0)
     */
    public static double calculate(FingerprintSet x, FingerprintSet y) {
        if (x.isEmpty() || y.isEmpty()) {
            return EMPTY_SET_SIMILARITY;
        }
        int intersection = x.intersectionSize(y);
        int union = x.size() + y.size() - intersection;
        return (double) intersection / union;
    }
}
