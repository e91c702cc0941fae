package com.entity.pipeline.similarity;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OptimalStringAlignmentTest {

    private final OptimalStringAlignment algorithm = new OptimalStringAlignment();

    @ParameterizedTest(name = "{0} / {1} -> {2}")
    @CsvSource({
            "jeffrey epstein, jeffrey epstein, 0",
            "jeffrey epstein, jeffery epstein, 1",
            "maxwell, maxwel, 1",
            "kitten, sitting, 3",
            "ab, ba, 1",
            "ca, abc, 3",
            "'', abc, 3"
    })
    void distance(String a, String b, int expected) {
        assertEquals(expected, algorithm.distance(a, b));
        assertEquals(expected, algorithm.distance(b, a));
    }

    @Test
    void boundedDistance_stopsAboveBound() {
        assertEquals(3, algorithm.boundedDistance("epstein", "maxwell", 2));
    }

    @Test
    void boundedDistance_lengthGapExceedsBound() {
        assertEquals(2, algorithm.boundedDistance("al", "alexandra", 1));
    }

    @Test
    void boundedDistance_exactWithinBound() {
        assertEquals(1, algorithm.boundedDistance("jeffrey", "jeffery", 2));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> algorithm.distance(null, "a"));
    }
}
