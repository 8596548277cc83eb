package com.gt.subjunctive.model;

import java.util.List;

public record Feedback(String headline,
                       String explanation,
                       String ruleExplanation,
                       String correctAnswer,
                       List<String> suggestions,
                       String elaboration) {

    public Feedback withElaboration(String elaboration) {
        return new Feedback(headline, explanation, ruleExplanation, correctAnswer, suggestions, elaboration);
    }
}
