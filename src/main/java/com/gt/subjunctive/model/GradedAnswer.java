package com.gt.subjunctive.model;

// Result is null when a legacy exercise had to be graded against its stored answers
public record GradedAnswer(ValidationVerdict verdict, ConjugationResult result) { }
