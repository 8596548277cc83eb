package com.gt.subjunctive.model;

import java.util.ArrayList;
import java.util.List;

public record ConjugationResult(String verb,
                                Tense tense,
                                Person person,
                                String canonical,
                                List<String> alternates,
                                String stem,
                                String ending,
                                boolean irregularForm,
                                boolean stemChanged,
                                String spellingRule,
                                String ruleExplanation) {

    public List<String> acceptedForms() {
        List<String> forms = new ArrayList<>();
        forms.add(canonical);
        forms.addAll(alternates);

        return forms;
    }

    public boolean hasSpellingChange() {
        return spellingRule != null;
    }
}
