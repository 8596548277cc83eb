package com.gt.subjunctive.model;

import java.util.Map;
import java.util.Optional;

public record Verb(String infinitive,
                   String translation,
                   Regularity regularity,
                   StemChange stemChange,
                   String stemChangeVowel,
                   String stemChangeReplacement,
                   String presentStem,
                   String imperfectBase,
                   String pastParticiple,
                   Map<Tense, Map<Person, String>> overrides,
                   Map<Person, String> presentIndicative,
                   Map<Person, String> imperfectIndicative,
                   boolean common) {

    public ConjugationClass conjugationClass() {
        return ConjugationClass.fromInfinitive(infinitive);
    }

    public boolean isIrregular() {
        return regularity == Regularity.Irregular;
    }

    public boolean hasStemChange() {
        return stemChange != null && stemChange != StemChange.None;
    }

    public Optional<String> getOverride(Tense tense, Person person) {
        Map<Person, String> tenseOverrides = overrides.get(tense);
        if (tenseOverrides == null) {
            return Optional.empty();
        }

        return Optional.ofNullable(tenseOverrides.get(person));
    }

    // True when the verb needs more than a stem change to conjugate
    public boolean hasIrregularForms() {
        return presentStem != null || imperfectBase != null || !overrides.isEmpty();
    }

    public Difficulty minimumDifficulty() {
        if (!isIrregular()) {
            return Difficulty.Beginner;
        }
        if (common || !hasIrregularForms()) {
            return Difficulty.Intermediate;
        }

        return Difficulty.Advanced;
    }
}
