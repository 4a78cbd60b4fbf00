package com.raditha.codetwin.analyzer;

/**
 * The comparison did not finish within the configured time limit.
 * No partial report is produced.
 */
public class ComparisonTimeoutException extends RuntimeException {

    public ComparisonTimeoutException(long timeoutSeconds, Throwable cause) {
        super("Comparison did not complete within " + timeoutSeconds + " seconds", cause);
    }
}
