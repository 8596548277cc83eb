package com.gt.subjunctive.model;

import java.time.Instant;
import java.util.List;

// Exercise as sent to the client, without the answer
public record ExercisePayload(String id,
                              String verb,
                              Tense tense,
                              Person person,
                              String triggerPhrase,
                              String triggerCategory,
                              String context,
                              String prompt,
                              Difficulty difficulty,
                              List<String> hints,
                              Instant createdInstant) {

    public static ExercisePayload fromExercise(Exercise exercise) {
        return new ExercisePayload(exercise.id(),
                exercise.verb(),
                exercise.tense(),
                exercise.person(),
                exercise.triggerPhrase(),
                exercise.triggerCategory(),
                exercise.context(),
                exercise.prompt(),
                exercise.difficulty(),
                exercise.hints(),
                exercise.createdInstant());
    }
}
