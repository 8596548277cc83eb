package com.gt.subjunctive.model;

public record ValidationVerdict(boolean correct,
                                String matchedForm,
                                ErrorKind errorKind,
                                boolean indicativeForm,
                                boolean accentWarning,
                                boolean nearMiss,
                                boolean degraded) {

    public static ValidationVerdict correct(String matchedForm, boolean accentWarning) {
        return new ValidationVerdict(true, matchedForm, ErrorKind.None, false, accentWarning, false, false);
    }

    public static ValidationVerdict incorrect(ErrorKind errorKind, boolean indicativeForm, boolean nearMiss) {
        return new ValidationVerdict(false, null, errorKind, indicativeForm, false, nearMiss, false);
    }

    public ValidationVerdict asDegraded() {
        return new ValidationVerdict(correct, matchedForm, errorKind, indicativeForm, accentWarning, nearMiss, true);
    }
}
