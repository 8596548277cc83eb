package com.gt.subjunctive.validation;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

// Bounded Levenshtein distance between an answer and the accepted forms
public class FormFuzzyMatcher {

    private FormFuzzyMatcher() { }

    public static Optional<String> findClosest(String target, Collection<String> forms, int maxDistance) {
        return forms.stream()
                .map(form -> new DistanceAndForm(levenshteinDistance(target, form, maxDistance), form))
                .filter(dnf -> dnf.distance() <= maxDistance)
                .min(Comparator.comparingInt(DistanceAndForm::distance))
                .map(DistanceAndForm::form);
    }

    // Returns maxDistance + 1 as soon as every cell of a row exceeds maxDistance
    static int levenshteinDistance(String left, String right, int maxDistance) {
        int[] v0 = new int[right.length() + 1];
        int[] v1 = new int[right.length() + 1];
        for (int i = 0; i < v0.length; i++) {
            v0[i] = i;
        }

        for (int i = 0; i < left.length(); i++) {
            v1[0] = i + 1;
            int rowMin = v1[0];

            for (int j = 0; j < right.length(); j++) {
                int delCost = v0[j + 1] + 1;
                int insertCost = v1[j] + 1;
                int subCost = left.charAt(i) == right.charAt(j) ? v0[j] : v0[j] + 1;

                v1[j + 1] = Integer.min(Integer.min(delCost, insertCost), subCost);
                rowMin = Integer.min(rowMin, v1[j + 1]);
            }

            if (rowMin > maxDistance) {
                return maxDistance + 1;
            }

            int[] temp = v0;
            v0 = v1;
            v1 = temp;
        }

        return v0[right.length()];
    }

    private record DistanceAndForm(int distance, String form) { }
}
