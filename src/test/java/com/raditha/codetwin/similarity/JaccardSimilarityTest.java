package com.raditha.codetwin.similarity;

import com.raditha.codetwin.model.FingerprintSet;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JaccardSimilarityTest {

    @Test
    void testIdenticalSets() {
        FingerprintSet set = FingerprintSet.of(List.of("a", "b", "c"));
        assertEquals(1.0, JaccardSimilarity.calculate(set, set), 0.0);
    }

    @Test
    void testDisjointSets() {
        assertEquals(0.0, JaccardSimilarity.calculate(
                FingerprintSet.of(List.of("a", "b")),
                FingerprintSet.of(List.of("c", "d"))), 0.0);
    }

    @Test
    void testPartialOverlap() {
        // intersection {b, c}, union {a, b, c, d}
        assertEquals(0.5, JaccardSimilarity.calculate(
                FingerprintSet.of(List.of("a", "b", "c")),
                FingerprintSet.of(List.of("b", "c", "d"))), 1e-12);
    }

    @Test
    void testEmptySetPolicy() {
        FingerprintSet empty = FingerprintSet.empty();
        FingerprintSet some = FingerprintSet.of(List.of("a"));

        assertEquals(JaccardSimilarity.EMPTY_SET_SIMILARITY, JaccardSimilarity.calculate(empty, empty), 0.0);
        assertEquals(JaccardSimilarity.EMPTY_SET_SIMILARITY, JaccardSimilarity.calculate(empty, some), 0.0);
        assertEquals(JaccardSimilarity.EMPTY_SET_SIMILARITY, JaccardSimilarity.calculate(some, empty), 0.0);
        assertEquals(0.0, JaccardSimilarity.EMPTY_SET_SIMILARITY, 0.0);
    }

    @Property
    void boundedAndSymmetric(
            @ForAll @Size(max = 20) Set<@AlphaChars @StringLength(min = 1, max = 3) String> x,
            @ForAll @Size(max = 20) Set<@AlphaChars @StringLength(min = 1, max = 3) String> y) {
        FingerprintSet a = FingerprintSet.of(x);
        FingerprintSet b = FingerprintSet.of(y);

        double ab = JaccardSimilarity.calculate(a, b);
        double ba = JaccardSimilarity.calculate(b, a);

        assertTrue(ab >= 0.0 && ab <= 1.0, "out of range: " + ab);
        assertEquals(ab, ba, 0.0);
    }

    @Property
    void selfSimilarityIsOne(
            @ForAll @Size(min = 1, max = 20) Set<@AlphaChars @StringLength(min = 1, max = 4) String> x) {
        FingerprintSet a = FingerprintSet.of(x);
        assertEquals(1.0, JaccardSimilarity.calculate(a, a), 0.0);
    }
}
