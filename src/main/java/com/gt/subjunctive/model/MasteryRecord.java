package com.gt.subjunctive.model;

import java.time.Duration;
import java.time.Instant;

public record MasteryRecord(String userId,
                            String verb,
                            int consecutiveCorrect,
                            int totalAttempts,
                            int totalCorrect,
                            Duration currentInterval,
                            Instant nextReviewInstant,
                            boolean lastCorrect,
                            Instant lastAttemptInstant,
                            long version) { }
