package com.gt.subjunctive.exercise;

import com.gt.subjunctive.model.Attempt;
import com.gt.subjunctive.model.Difficulty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

// Moves a user up or down a tier based on accuracy and answer speed over their most recent attempts
@Component
public class DifficultyAdvisor {

    private static final Logger log = LoggerFactory.getLogger(DifficultyAdvisor.class);

    private final double stepUpAccuracy;
    private final double stepDownAccuracy;
    private final int minimumAttempts;
    private final long stepUpMaxAvgElapsedMs;

    @Autowired
    public DifficultyAdvisor(@Value("${subjunctive.exercise.stepUpAccuracy:0.85}") double stepUpAccuracy,
                             @Value("${subjunctive.exercise.stepDownAccuracy:0.60}") double stepDownAccuracy,
                             @Value("${subjunctive.exercise.minimumAttemptsForAdjustment:5}") int minimumAttempts,
                             @Value("${subjunctive.exercise.stepUpMaxAvgElapsedMs:5000}") long stepUpMaxAvgElapsedMs) {
        this.stepUpAccuracy = stepUpAccuracy;
        this.stepDownAccuracy = stepDownAccuracy;
        this.minimumAttempts = minimumAttempts;
        this.stepUpMaxAvgElapsedMs = stepUpMaxAvgElapsedMs;
    }

    public Difficulty recommend(Difficulty current, List<Attempt> recentAttempts) {
        Difficulty base = current == null ? Difficulty.Beginner : current;
        if (recentAttempts.size() < minimumAttempts) {
            return base;
        }

        long correct = recentAttempts.stream().filter(Attempt::correct).count();
        double accuracy = (double) correct / recentAttempts.size();

        OptionalDouble avgElapsedMs = averageElapsedMs(recentAttempts);

        Difficulty recommended = base;
        if (accuracy >= stepUpAccuracy) {
            if (avgElapsedMs.isPresent() && avgElapsedMs.getAsDouble() >= stepUpMaxAvgElapsedMs) {
                log.debug("Accuracy {} is high but average answer time {} ms is too slow to leave {}", accuracy,
                        avgElapsedMs.getAsDouble(), base.getCode());
            } else {
                recommended = base.harder();
            }
        } else if (accuracy < stepDownAccuracy) {
            recommended = base.easier();
        }

        if (recommended != base) {
            log.debug("Accuracy {} over {} attempts moves difficulty from {} to {}", accuracy, recentAttempts.size(),
                    base.getCode(), recommended.getCode());
        }

        return recommended;
    }

    // Attempts submitted without a timing are left out of the average
    private static OptionalDouble averageElapsedMs(List<Attempt> attempts) {
        return attempts.stream()
                .map(Attempt::elapsedTimeMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average();
    }
}
