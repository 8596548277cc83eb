package com.gt.subjunctive.feedback.impl;

import com.gt.subjunctive.feedback.FeedbackElaborator;

public class DisabledFeedbackElaborator implements FeedbackElaborator {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String elaborate(String prompt) {
        throw new IllegalStateException("Feedback elaboration is disabled");
    }
}
