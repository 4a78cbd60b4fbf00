package com.raditha.codetwin.fingerprint;

import com.raditha.codetwin.model.CanonicalSequence;
import com.raditha.codetwin.model.FingerprintSet;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a canonical sequence into a set of k-shingle digests.
 * <p>
 * Every window of {@code k} consecutive tokens is joined with a separator
 * that cannot occur inside a token and hashed with SHA-1. A sequence shorter
 * than {@code k} (but not empty) yields a single digest over the whole
 * sequence, so short files still take part. An empty sequence yields the
 * empty set.
 */
public class Fingerprinter {

    /**
     * U+241F SYMBOL FOR UNIT SEPARATOR. Keeps {@code ["ab","c"]} and
     * {@code ["a","bc"]} apart.
     */
    public static final String SEPARATOR = "␟";

    private final int shingleSize;

    /**
     * @param shingleSize tokens per window (k)
     */
    public Fingerprinter(int shingleSize) {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("shingleSize must be >= 1, got " + shingleSize);
        }
        this.shingleSize = shingleSize;
    }

    public FingerprintSet fingerprint(CanonicalSequence sequence) {
        List<String> tokens = sequence.tokens();
        if (tokens.isEmpty()) {
            return FingerprintSet.empty();
        }

        Set<String> digests = new TreeSet<>();
        if (tokens.size() < shingleSize) {
            digests.add(digest(tokens));
        } else {
            for (int i = 0; i <= tokens.size() - shingleSize; i++) {
                digests.add(digest(tokens.subList(i, i + shingleSize)));
            }
        }
        return FingerprintSet.of(digests);
    }

    static String digest(List<String> window) {
        return DigestUtils.sha1Hex(String.join(SEPARATOR, window));
    }
}
