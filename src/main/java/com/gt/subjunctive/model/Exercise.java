package com.gt.subjunctive.model;

import java.time.Instant;
import java.util.List;

public record Exercise(String id,
                       String userId,
                       String verb,
                       Tense tense,
                       Person person,
                       String triggerPhrase,
                       String triggerCategory,
                       String context,
                       String prompt,
                       String correctAnswer,
                       List<String> alternates,
                       Difficulty difficulty,
                       List<String> hints,
                       Instant createdInstant) {

    public ExerciseKey key() {
        return new ExerciseKey(verb, tense, person);
    }

    // Rows written before person was stored have to recover it from the prompt text
    public boolean isLegacy() {
        return person == null;
    }
}
