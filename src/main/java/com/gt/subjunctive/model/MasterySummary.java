package com.gt.subjunctive.model;

import java.time.Instant;

public record MasterySummary(String verb,
                             MasteryLevel level,
                             int consecutiveCorrect,
                             int totalAttempts,
                             int totalCorrect,
                             long currentIntervalSec,
                             Instant nextReviewInstant) { }
