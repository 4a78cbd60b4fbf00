package com.raditha.codetwin.fingerprint;

import com.raditha.codetwin.model.CanonicalSequence;
import com.raditha.codetwin.model.FingerprintSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FingerprinterTest {

    private static CanonicalSequence seq(String... tokens) {
        return new CanonicalSequence(List.of(tokens));
    }

    @Test
    void testLengthSevenWithKFive() {
        FingerprintSet set = new Fingerprinter(5).fingerprint(seq("a", "b", "c", "d", "e", "f", "g"));
        assertEquals(3, set.size());
    }

    @Test
    void testRepeatedShinglesCollapse() {
        // "x y x y x y" has two distinct 2-shingles out of five windows
        FingerprintSet set = new Fingerprinter(2).fingerprint(seq("x", "y", "x", "y", "x", "y"));
        assertEquals(2, set.size());
    }

    @Test
    void testShingleCountLaw() {
        for (int k = 1; k <= 8; k++) {
            Fingerprinter fingerprinter = new Fingerprinter(k);
            for (int n = 0; n <= 20; n++) {
                List<String> tokens = new ArrayList<>();
                for (int i = 0; i < n; i++) {
                    tokens.add("T" + (i % 4));
                }
                int size = fingerprinter.fingerprint(new CanonicalSequence(tokens)).size();
                if (n == 0) {
                    assertEquals(0, size, "n=0 k=" + k);
                } else if (n < k) {
                    assertEquals(1, size, "n=" + n + " k=" + k);
                } else {
                    assertTrue(size >= 1 && size <= n - k + 1, "n=" + n + " k=" + k + " size=" + size);
                }
            }
        }
    }

    @Test
    void testShortSequenceYieldsSingleFingerprint() {
        FingerprintSet set = new Fingerprinter(5).fingerprint(seq("if", "else", "return"));
        assertEquals(1, set.size());
        assertEquals(Fingerprinter.digest(List.of("if", "else", "return")), set.fingerprints().first());
    }

    @Test
    void testEmptySequence() {
        assertTrue(new Fingerprinter(5).fingerprint(new CanonicalSequence(List.of())).isEmpty());
    }

    @Test
    void testDigestsAreSha1Hex() {
        FingerprintSet set = new Fingerprinter(2).fingerprint(seq("ID1", "=", "NUM", ";"));
        for (String digest : set.fingerprints()) {
            assertTrue(digest.matches("[0-9a-f]{40}"), digest);
        }
    }

    @Test
    void testSeparatorKeepsTokenBoundaries() {
        Fingerprinter fingerprinter = new Fingerprinter(2);
        assertNotEquals(
                fingerprinter.fingerprint(seq("ab", "c")),
                fingerprinter.fingerprint(seq("a", "bc")));
    }

    @Test
    void testDeterministic() {
        CanonicalSequence sequence = seq("class", "ID1", "{", "return", "NUM", ";", "}");
        assertEquals(new Fingerprinter(3).fingerprint(sequence), new Fingerprinter(3).fingerprint(sequence));
    }

    @Test
    void testInvalidShingleSize() {
        assertThrows(IllegalArgumentException.class, () -> new Fingerprinter(0));
        assertThrows(IllegalArgumentException.class, () -> new Fingerprinter(-3));
    }
}
