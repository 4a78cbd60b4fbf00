package com.raditha.codetwin.analyzer;

import com.raditha.codetwin.collector.FileSetCollector;
import com.raditha.codetwin.collector.SourceReader;
import com.raditha.codetwin.config.ComparisonConfig;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.ProcessingWarning;
import com.raditha.codetwin.model.Side;
import com.raditha.codetwin.model.SourceFile;
import com.raditha.codetwin.similarity.SimilarityEngine;
import com.raditha.codetwin.similarity.SimilarityOutcome;
import com.raditha.codetwin.tokenization.TokenLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main orchestrator for a comparison run.
 * Coordinates collection, reading, per-file processing, pairwise scoring and
 * report assembly.
 * <p>
 * Files are read on an I/O pool and processed on a compute pool sized by
 * {@link ComparisonConfig#threads()}. Both pools live only for the duration
 * of one run. Files that cannot be read, are too large or have too many
 * tokens are left out and reported as warnings; any other failure aborts the
 * run.
 */
public class ComparisonAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonAnalyzer.class);

    private static final Comparator<ProcessingWarning> WARNING_ORDER = Comparator
            .comparing(ProcessingWarning::side)
            .thenComparing(ProcessingWarning::path);

    private final ComparisonConfig config;
    private final FileSetCollector collector;
    private final SourceReader reader;
    private final FileProcessor processor;

    /**
     * Create analyzer with default configuration.
     */
    public ComparisonAnalyzer() {
        this(ComparisonConfig.standard());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public ComparisonAnalyzer(ComparisonConfig config) {
        this(config,
                new FileSetCollector(config.excludedDirectories(), config.grammars()),
                new SourceReader(config.maxFileBytes()));
    }

    public ComparisonAnalyzer(ComparisonConfig config, FileSetCollector collector, SourceReader reader) {
        this.config = config;
        this.collector = collector;
        this.reader = reader;
        this.processor = new FileProcessor(config);
    }

    /**
     * Compare two directory trees.
     *
     * @param rootA root of collection A
     * @param rootB root of collection B
     * @return the comparison report
     * @throws IllegalArgumentException   if either root is not a directory
     * @throws IOException                if a directory walk fails
     * @throws InterruptedException       if the run is interrupted
     * @throws ComparisonTimeoutException if the run exceeds the time limit
     */
    public ComparisonReport compare(Path rootA, Path rootB) throws IOException, InterruptedException {
        requireDirectory(rootA, "A");
        requireDirectory(rootB, "B");

        List<String> pathsA = collector.collect(rootA);
        List<String> pathsB = collector.collect(rootB);
        logger.info("Comparing {} files from {} against {} files from {} (k={})",
                pathsA.size(), rootA, pathsB.size(), rootB, config.shingleSize());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.timeoutSeconds());
        ExecutorService ioPool = Executors.newFixedThreadPool(config.threads(), namedThreads("codetwin-io"));
        ExecutorService computePool = Executors.newFixedThreadPool(config.threads(), namedThreads("codetwin-compute"));
        try {
            List<Job> jobs = new ArrayList<>(pathsA.size() + pathsB.size());
            submitReads(jobs, rootA, pathsA, Side.A, ioPool, computePool);
            submitReads(jobs, rootB, pathsB, Side.B, ioPool, computePool);
            return finish(rootA.toString(), rootB.toString(), jobs, deadline, computePool);
        } finally {
            ioPool.shutdownNow();
            computePool.shutdownNow();
        }
    }

    /**
     * Compare two in-memory collections. No file system access.
     */
    public ComparisonReport compareSources(List<SourceFile> sourcesA, List<SourceFile> sourcesB)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.timeoutSeconds());
        ExecutorService computePool = Executors.newFixedThreadPool(config.threads(), namedThreads("codetwin-compute"));
        try {
            List<Job> jobs = new ArrayList<>(sourcesA.size() + sourcesB.size());
            for (SourceFile source : sourcesA) {
                jobs.add(new Job(Side.A, source.path(),
                        CompletableFuture.supplyAsync(() -> processor.process(source), computePool)));
            }
            for (SourceFile source : sourcesB) {
                jobs.add(new Job(Side.B, source.path(),
                        CompletableFuture.supplyAsync(() -> processor.process(source), computePool)));
            }
            return finish(Side.A.name(), Side.B.name(), jobs, deadline, computePool);
        } finally {
            computePool.shutdownNow();
        }
    }

    /**
     * Reading happens on the I/O pool, processing continues on the compute
     * pool so that slow disks never starve tokenization.
     */
    private void submitReads(List<Job> jobs, Path root, List<String> paths, Side side,
            ExecutorService ioPool, ExecutorService computePool) {
        for (String path : paths) {
            CompletableFuture<FileFingerprint> future = CompletableFuture
                    .supplyAsync(() -> read(root, path, side), ioPool)
                    .thenApplyAsync(processor::process, computePool);
            jobs.add(new Job(side, path, future));
        }
    }

    private SourceFile read(Path root, String path, Side side) {
        try {
            return reader.read(root, path, side);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ComparisonReport finish(String labelA, String labelB, List<Job> jobs, long deadline,
            ExecutorService computePool) throws InterruptedException {
        List<FileFingerprint> filesA = new ArrayList<>();
        List<FileFingerprint> filesB = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();

        for (Job job : jobs) {
            FileFingerprint result = await(job, jobs, deadline, warnings);
            if (result == null) {
                continue;
            }
            if (job.side() == Side.A) {
                filesA.add(result);
            } else {
                filesB.add(result);
            }
        }
        filesA.sort(Comparator.comparing(FileFingerprint::path));
        filesB.sort(Comparator.comparing(FileFingerprint::path));
        warnings.sort(WARNING_ORDER);

        SimilarityEngine engine = new SimilarityEngine(computePool);
        SimilarityOutcome outcome;
        try {
            outcome = engine.compare(filesA, filesB, remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new ComparisonTimeoutException(config.timeoutSeconds(), e);
        }

        if (!warnings.isEmpty()) {
            logger.warn("{} files were skipped", warnings.size());
        }
        logger.info("Overall similarity: {}%", outcome.aggregate().percent());

        return new ComparisonReport(
                LocalDateTime.now(),
                labelA,
                labelB,
                config.shingleSize(),
                filesA,
                filesB,
                outcome.pairs(),
                outcome.aggregate(),
                warnings);
    }

    /**
     * Wait for one file. Returns null when the file was skipped, after
     * recording why.
     */
    private FileFingerprint await(Job job, List<Job> jobs, long deadline, List<ProcessingWarning> warnings)
            throws InterruptedException {
        try {
            return job.future().get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            jobs.forEach(j -> j.future().cancel(true));
            throw new ComparisonTimeoutException(config.timeoutSeconds(), e);
        } catch (ExecutionException e) {
            String reason = skipReason(e.getCause());
            if (reason == null) {
                throw new IllegalStateException(
                        "Failed to process " + job.side().qualify(job.path()), e.getCause());
            }
            logger.warn("Skipping {}: {}", job.side().qualify(job.path()), reason);
            warnings.add(new ProcessingWarning(job.side(), job.path(), reason));
            return null;
        }
    }

    /**
     * Message for a recoverable per-file failure, or null if the failure
     * should abort the run.
     */
    static String skipReason(Throwable cause) {
        if (cause instanceof UncheckedIOException unchecked) {
            cause = unchecked.getCause();
        }
        if (cause instanceof IOException || cause instanceof TokenLimitExceededException) {
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        return null;
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private static void requireDirectory(Path root, String label) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Collection " + label + " is not a directory: " + root);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * One file in flight.
     */
    private record Job(Side side, String path, CompletableFuture<FileFingerprint> future) {
    }
}
