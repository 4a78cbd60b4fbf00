package com.raditha.codetwin.analyzer;

import com.raditha.codetwin.model.AggregateScore;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.PairwiseResult;
import com.raditha.codetwin.model.ProcessingWarning;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Result of comparing two collections.
 * Files are listed in path order, pairs highest similarity first.
 */
public record ComparisonReport(
        LocalDateTime timestamp,
        String repoA,
        String repoB,
        int shingleSize,
        List<FileFingerprint> filesA,
        List<FileFingerprint> filesB,
        List<PairwiseResult> pairs,
        AggregateScore aggregate,
        List<ProcessingWarning> warnings) {

    public ComparisonReport {
        filesA = List.copyOf(filesA);
        filesB = List.copyOf(filesB);
        pairs = List.copyOf(pairs);
        warnings = List.copyOf(warnings);
    }

    /**
     * Number of file pairs that were scored.
     */
    public int totalComparisons() {
        return filesA.size() * filesB.size();
    }

    /**
     * The {@code n} most similar pairs.
     */
    public List<PairwiseResult> getTopPairs(int n) {
        return pairs.subList(0, Math.min(Math.max(n, 0), pairs.size()));
    }

    /**
     * Files of both collections, A first.
     */
    public List<FileFingerprint> allFiles() {
        List<FileFingerprint> all = new ArrayList<>(filesA);
        all.addAll(filesB);
        return all;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * One-line summary.
     */
    public String getSummary() {
        if (!aggregate.defined()) {
            return String.format(Locale.ROOT, "Similarity undefined: %d files in A, %d files in B",
                    filesA.size(), filesB.size());
        }
        return String.format(Locale.ROOT,
                "Overall similarity %.2f%% (A->B %.2f%%, B->A %.2f%%) across %d comparisons, k=%d",
                aggregate.percent(),
                aggregate.aToB() * 100,
                aggregate.bToA() * 100,
                totalComparisons(),
                shingleSize);
    }
}
