package com.raditha.codetwin.config;

import java.util.Set;

/**
 * Configuration for a comparison run.
 * Validated on construction, so an invalid run is rejected before any file
 * is read.
 *
 * @param shingleSize         tokens per shingle window (k), at least 1
 * @param keywords            combined reserved-word set, never empty
 * @param grammars            extension allow-list and comment grammar per
 *                            extension
 * @param excludedDirectories directory names skipped while collecting files
 * @param threads             size of the compute pool
 * @param maxFileBytes        larger files are skipped with a warning
 * @param maxTokensPerFile    files producing more tokens are skipped with a
 *                            warning
 * @param previewTokens       canonical tokens kept per file for the report
 * @param timeoutSeconds      limit for the whole run
 */
public record ComparisonConfig(
        int shingleSize,
        Set<String> keywords,
        GrammarRegistry grammars,
        Set<String> excludedDirectories,
        int threads,
        long maxFileBytes,
        int maxTokensPerFile,
        int previewTokens,
        long timeoutSeconds) {

    public static final int DEFAULT_SHINGLE_SIZE = 5;
    public static final long DEFAULT_MAX_FILE_BYTES = 2L * 1024 * 1024;
    public static final int DEFAULT_MAX_TOKENS = 1_000_000;
    public static final int DEFAULT_PREVIEW_TOKENS = 80;
    public static final long DEFAULT_TIMEOUT_SECONDS = 600;

    /**
     * Validate configuration.
     */
    public ComparisonConfig {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("shingleSize must be >= 1, got " + shingleSize);
        }
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keyword set cannot be empty");
        }
        if (grammars == null) {
            throw new IllegalArgumentException("grammars cannot be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        if (maxFileBytes < 1) {
            throw new IllegalArgumentException("maxFileBytes must be >= 1");
        }
        if (maxTokensPerFile < 1) {
            throw new IllegalArgumentException("maxTokensPerFile must be >= 1");
        }
        if (previewTokens < 0) {
            throw new IllegalArgumentException("previewTokens must be >= 0");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 1");
        }
        keywords = Set.copyOf(keywords);
        excludedDirectories = excludedDirectories == null ? Set.of() : Set.copyOf(excludedDirectories);
    }

    /**
     * Standard preset: 5-token shingles. Good default for most code.
     */
    public static ComparisonConfig standard() {
        return create(DEFAULT_SHINGLE_SIZE);
    }

    /**
     * Fine preset: 3-token shingles.
     * Catches smaller shared fragments at the cost of more incidental matches.
     */
    public static ComparisonConfig fine() {
        return create(3);
    }

    /**
     * Coarse preset: 8-token shingles.
     * Only longer identical runs count, so scores drop for lightly edited code.
     */
    public static ComparisonConfig coarse() {
        return create(8);
    }

    /**
     * Resolve a preset by name. Unknown names are a configuration error.
     */
    public static ComparisonConfig preset(String name) {
        if (name == null) {
            return standard();
        }
        return switch (name.toLowerCase()) {
            case "standard" -> standard();
            case "fine" -> fine();
            case "coarse" -> coarse();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + name + ". Must be: standard, fine, or coarse");
        };
    }

    private static ComparisonConfig create(int k) {
        return new ComparisonConfig(
                k,
                Keywords.combined(),
                GrammarRegistry.defaults(),
                defaultExcludedDirectories(),
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_MAX_FILE_BYTES,
                DEFAULT_MAX_TOKENS,
                DEFAULT_PREVIEW_TOKENS,
                DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Directories that never hold code worth comparing.
     */
    public static Set<String> defaultExcludedDirectories() {
        return Set.of(
                ".git",
                "__pycache__",
                "node_modules",
                ".metadata",
                ".idea",
                ".vscode",
                "target",
                "build",
                ".DS_Store");
    }

    public ComparisonConfig withShingleSize(int k) {
        return new ComparisonConfig(k, keywords, grammars, excludedDirectories, threads,
                maxFileBytes, maxTokensPerFile, previewTokens, timeoutSeconds);
    }

    public ComparisonConfig withThreads(int n) {
        return new ComparisonConfig(shingleSize, keywords, grammars, excludedDirectories, n,
                maxFileBytes, maxTokensPerFile, previewTokens, timeoutSeconds);
    }
}
