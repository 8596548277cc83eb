package com.gt.subjunctive.validation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FormFuzzyMatcherTests {

    private static final List<String> forms = List.of(
            "hablara",    // d("hablra") = 1
            "hablase",    // d("hablra") = 3
            "hablaramos"); // d("hablra") = 4

    @Test
    public void testLevenshteinDistance() {
        assertEquals(0, FormFuzzyMatcher.levenshteinDistance("piense", "piense", 4));
        assertEquals(1, FormFuzzyMatcher.levenshteinDistance("pinse", "piense", 4));
        assertEquals(1, FormFuzzyMatcher.levenshteinDistance("piensa", "piense", 4));
        assertEquals(2, FormFuzzyMatcher.levenshteinDistance("pensa", "piense", 4));
        assertEquals(3, FormFuzzyMatcher.levenshteinDistance("hable", "hablemos", 4));
        assertEquals(4, FormFuzzyMatcher.levenshteinDistance("hablra", "hablaramos", 6));
    }

    @Test
    public void testLevenshteinDistance_maxDistanceExceeded() {
        assertEquals(3, FormFuzzyMatcher.levenshteinDistance("hable", "comieran", 2));
        assertEquals(2, FormFuzzyMatcher.levenshteinDistance("xyz", "hablemos", 1));
    }

    @Test
    public void testFindClosest() {
        assertEquals(Optional.of("hablara"), FormFuzzyMatcher.findClosest("hablra", forms, 2));
        assertEquals(Optional.of("hablara"), FormFuzzyMatcher.findClosest("hablra", forms, 1));
        assertEquals(Optional.empty(), FormFuzzyMatcher.findClosest("comiera", forms, 2));
    }
}
