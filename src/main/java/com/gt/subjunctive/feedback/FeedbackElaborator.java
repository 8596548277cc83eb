package com.gt.subjunctive.feedback;

// Optional natural-language collaborator that expands on the deterministic explanation
public interface FeedbackElaborator {

    boolean isEnabled();

    String elaborate(String prompt);
}
