package com.gt.subjunctive.model;

import java.time.Instant;

public record Attempt(String id,
                      String userId,
                      String exerciseId,
                      String verb,
                      String submittedText,
                      Instant attemptInstant,
                      boolean correct,
                      ErrorKind errorKind,
                      Long elapsedTimeMs) { }
