package com.gt.subjunctive.exercise;

import com.gt.subjunctive.model.Difficulty;
import com.gt.subjunctive.model.Exercise;
import com.gt.subjunctive.model.ExerciseKey;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

public interface ExerciseDao {

    void saveExercise(Exercise exercise);

    Optional<Exercise> loadExercise(String exerciseId);

    Set<ExerciseKey> loadRecentExerciseKeys(String userId, int limit);

    Optional<Difficulty> loadLatestDifficulty(String userId);

    int deleteExercisesForUser(String userId);

    int purgeUnattemptedExercises(Instant cutoff);
}
