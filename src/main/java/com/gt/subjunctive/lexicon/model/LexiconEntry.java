package com.gt.subjunctive.lexicon.model;

import java.util.Map;

// One verb as written in verbs.json. Codes are resolved to enums when the lexicon is built.
public record LexiconEntry(String infinitive,
                           String translation,
                           String regularity,
                           String stemChange,
                           String stemChangeVowel,
                           String stemChangeReplacement,
                           String presentStem,
                           String imperfectBase,
                           String pastParticiple,
                           Map<String, Map<String, String>> overrides,
                           Map<String, String> presentIndicative,
                           Map<String, String> imperfectIndicative,
                           boolean common) { }
