package com.gt.subjunctive.model;

public record VerbInfo(String infinitive,
                       String translation,
                       String conjugationClass,
                       String regularity,
                       String stemChange,
                       String spellingRule,
                       String pastParticiple,
                       Difficulty minimumDifficulty) { }
