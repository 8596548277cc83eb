package com.gt.subjunctive.model;

// Identifies a (verb, tense, person) combination shown to a user
public record ExerciseKey(String verb, Tense tense, Person person) { }
