package com.raditha.codetwin.model;

import java.util.List;

/**
 * Identifier-blind token sequence of one file: keywords verbatim, NUM, STR,
 * ID1..IDn and raw operators.
 *
 * @param tokens canonical tokens in source order
 */
public record CanonicalSequence(List<String> tokens) {

    public CanonicalSequence {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * Number of canonical tokens. Used as the file's weight in aggregation.
     */
    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * First {@code limit} tokens, for debugging output.
     */
    public List<String> preview(int limit) {
        return tokens.subList(0, Math.min(Math.max(limit, 0), tokens.size()));
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
