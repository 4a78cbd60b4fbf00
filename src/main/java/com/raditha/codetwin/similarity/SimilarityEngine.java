package com.raditha.codetwin.similarity;

import com.raditha.codetwin.model.AggregateScore;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.PairwiseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores every file of collection A against every file of collection B and
 * reduces the matrix to a symmetric repo-level similarity.
 * <p>
 * Each file keeps its best match on the other side. The directional score is
 * the mean of those best matches weighted by canonical length, and the
 * overall score is the mean of the two directions. Rows of the matrix are
 * scored in parallel on the supplied executor. Both sides are sorted by path
 * before scoring so that the outcome does not depend on input order or
 * scheduling.
 */
public class SimilarityEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityEngine.class);

    private static final Comparator<FileFingerprint> BY_PATH = Comparator.comparing(FileFingerprint::path);

    private final Executor executor;

    /**
     * Engine that scores on the calling thread.
     */
    public SimilarityEngine() {
        this(Runnable::run);
    }

    public SimilarityEngine(Executor executor) {
        this.executor = executor;
    }

    /**
     * Compare two collections and wait for the result without a time limit.
     */
    public SimilarityOutcome compare(List<FileFingerprint> filesA, List<FileFingerprint> filesB) {
        List<FileFingerprint> a = sorted(filesA);
        List<FileFingerprint> b = sorted(filesB);
        if (a.isEmpty() || b.isEmpty()) {
            return undefined(a, b);
        }
        List<CompletableFuture<double[]>> rows = scoreRows(a, b);
        try {
            CompletableFuture.allOf(rows.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Similarity scoring failed", e.getCause());
        }
        return assemble(a, b, rows);
    }

    /**
     * Compare two collections, giving up after {@code timeout}.
     *
     * @throws TimeoutException     if scoring did not finish in time; pending
     *                              rows are cancelled, running rows stop when
     *                              the executor interrupts them
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public SimilarityOutcome compare(List<FileFingerprint> filesA, List<FileFingerprint> filesB,
            long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        List<FileFingerprint> a = sorted(filesA);
        List<FileFingerprint> b = sorted(filesB);
        if (a.isEmpty() || b.isEmpty()) {
            return undefined(a, b);
        }
        List<CompletableFuture<double[]>> rows = scoreRows(a, b);
        CompletableFuture<Void> all = CompletableFuture.allOf(rows.toArray(new CompletableFuture[0]));
        try {
            all.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Similarity scoring failed", e.getCause());
        } catch (TimeoutException | InterruptedException e) {
            rows.forEach(row -> row.cancel(true));
            throw e;
        }
        return assemble(a, b, rows);
    }

    private List<CompletableFuture<double[]>> scoreRows(List<FileFingerprint> a, List<FileFingerprint> b) {
        List<CompletableFuture<double[]>> rows = new ArrayList<>(a.size());
        for (FileFingerprint fileA : a) {
            rows.add(CompletableFuture.supplyAsync(() -> scoreRow(fileA, b), executor));
        }
        return rows;
    }

    /**
     * Stops early once its thread is interrupted, which is how a pool shut
     * down after a timeout reclaims rows already running.
     */
    private static double[] scoreRow(FileFingerprint fileA, List<FileFingerprint> b) {
        double[] row = new double[b.size()];
        for (int j = 0; j < b.size(); j++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("scoring interrupted at " + fileA.path());
            }
            row[j] = JaccardSimilarity.calculate(fileA.fingerprints(), b.get(j).fingerprints());
        }
        return row;
    }

    /**
     * Reduce the completed matrix. Runs on the calling thread in path order.
     */
    private SimilarityOutcome assemble(List<FileFingerprint> a, List<FileFingerprint> b,
            List<CompletableFuture<double[]>> rows) {
        List<PairwiseResult> pairs = new ArrayList<>(a.size() * b.size());
        double[] bestForA = new double[a.size()];
        double[] bestForB = new double[b.size()];

        for (int i = 0; i < a.size(); i++) {
            FileFingerprint fileA = a.get(i);
            double[] row = rows.get(i).join();
            for (int j = 0; j < b.size(); j++) {
                FileFingerprint fileB = b.get(j);
                double score = row[j];
                pairs.add(new PairwiseResult(
                        fileA.path(),
                        fileB.path(),
                        score,
                        fileA.fingerprints().size(),
                        fileB.fingerprints().size(),
                        fileA.normalizedTokenCount(),
                        fileB.normalizedTokenCount()));
                bestForA[i] = Math.max(bestForA[i], score);
                bestForB[j] = Math.max(bestForB[j], score);
            }
        }

        double aToB = weightedMean(a, bestForA);
        double bToA = weightedMean(b, bestForB);
        AggregateScore aggregate = AggregateScore.of(aToB, bToA);

        pairs.sort(PairwiseResult.BY_SIMILARITY);
        logger.debug("Scored {} pairs: A->B {}, B->A {}, overall {}",
                pairs.size(), aToB, bToA, aggregate.score());
        return new SimilarityOutcome(pairs, aggregate);
    }

    /**
     * Sum of weight * best score divided by the sum of weights.
     */
    static double weightedMean(List<FileFingerprint> files, double[] best) {
        double weighted = 0.0;
        long totalWeight = 0;
        for (int i = 0; i < files.size(); i++) {
            int weight = files.get(i).weight();
            weighted += weight * best[i];
            totalWeight += weight;
        }
        // guard against floating point drift above 1.0
        return Math.min(1.0, weighted / totalWeight);
    }

    private static SimilarityOutcome undefined(List<FileFingerprint> a, List<FileFingerprint> b) {
        logger.warn("Cannot compute similarity: collection A has {} files, collection B has {} files",
                a.size(), b.size());
        return new SimilarityOutcome(List.of(), AggregateScore.undefined());
    }

    private static List<FileFingerprint> sorted(List<FileFingerprint> files) {
        List<FileFingerprint> copy = new ArrayList<>(files);
        copy.sort(BY_PATH);
        return copy;
    }
}
