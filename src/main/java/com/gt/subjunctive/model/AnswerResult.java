package com.gt.subjunctive.model;

public record AnswerResult(boolean correct,
                           String correctAnswer,
                           ErrorKind errorKind,
                           Feedback feedback,
                           MasterySummary mastery) { }
