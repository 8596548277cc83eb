package com.gt.subjunctive.model;

import java.util.Set;

// Empty verb or tense sets mean no filter. A null difficulty means advanced
public record ExerciseCriteria(Set<String> verbs,
                               Set<Tense> tenses,
                               Difficulty difficulty,
                               Set<ExerciseKey> recentlySeen) {

    public static ExerciseCriteria unfiltered(Difficulty difficulty) {
        return new ExerciseCriteria(Set.of(), Set.of(), difficulty, Set.of());
    }
}
