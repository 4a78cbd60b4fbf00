package com.raditha.codetwin.tokenization;

/**
 * Thrown when a file produces more tokens than the configured cap.
 * The file is left out of the comparison.
 */
public class TokenLimitExceededException extends RuntimeException {

    private final int limit;

    public TokenLimitExceededException(int limit) {
        super("token count exceeds limit of " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
