package com.raditha.codetwin.model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable set of shingle digests for one file.
 * Kept sorted so that iteration and serialization are reproducible.
 *
 * @param fingerprints hex encoded digests
 */
public record FingerprintSet(SortedSet<String> fingerprints) {

    private static final FingerprintSet EMPTY = new FingerprintSet(new TreeSet<>());

    public FingerprintSet {
        fingerprints = Collections.unmodifiableSortedSet(
                fingerprints == null ? new TreeSet<>() : new TreeSet<>(fingerprints));
    }

    public static FingerprintSet of(Collection<String> digests) {
        return new FingerprintSet(new TreeSet<>(digests));
    }

    public static FingerprintSet empty() {
        return EMPTY;
    }

    public int size() {
        return fingerprints.size();
    }

    public boolean isEmpty() {
        return fingerprints.isEmpty();
    }

    /**
     * Count the digests shared with another set.
     * Iterates the smaller of the two sets.
     */
    public int intersectionSize(FingerprintSet other) {
        SortedSet<String> small = fingerprints.size() <= other.fingerprints.size() ? fingerprints : other.fingerprints;
        SortedSet<String> large = small == fingerprints ? other.fingerprints : fingerprints;
        int shared = 0;
        for (String digest : small) {
            if (large.contains(digest)) {
                shared++;
            }
        }
        return shared;
    }
}
