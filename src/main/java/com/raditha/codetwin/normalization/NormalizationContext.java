package com.raditha.codetwin.normalization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-file identifier renaming table.
 * The first distinct identifier becomes ID1, the second ID2, and so on.
 * A fresh context is used for every file, so numbering never leaks between
 * files.
 */
public class NormalizationContext {

    static final String PREFIX = "ID";

    private final Map<String, String> mapping = new LinkedHashMap<>();

    /**
     * Symbolic name for an identifier, allocating the next one on first use.
     */
    public String rename(String identifier) {
        return mapping.computeIfAbsent(identifier, k -> PREFIX + (mapping.size() + 1));
    }

    /**
     * Original identifier to symbolic name, in first-occurrence order.
     */
    public Map<String, String> identifierMap() {
        return Collections.unmodifiableMap(mapping);
    }

    public int size() {
        return mapping.size();
    }
}
