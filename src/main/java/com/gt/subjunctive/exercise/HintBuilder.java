package com.gt.subjunctive.exercise;

import com.gt.subjunctive.model.ConjugationResult;
import com.gt.subjunctive.model.Person;
import com.gt.subjunctive.model.Verb;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

// Progressive hints: translation, then a note on what makes the form tricky, then the person to conjugate for
@Component
public class HintBuilder {

    public List<String> buildHints(Verb verb, ConjugationResult result) {
        List<String> hints = new ArrayList<>();

        if (!verb.translation().isBlank()) {
            hints.add("'" + verb.infinitive() + "' means '" + verb.translation() + "'.");
        }

        String verbNote = verbNote(verb, result);
        if (verbNote != null) {
            hints.add(verbNote);
        }

        hints.add(personReminder(result.person()));

        return hints;
    }

    private static String verbNote(Verb verb, ConjugationResult result) {
        if (result.tense().isCompound()) {
            return "Use haber in the " + result.tense().getAuxiliaryTense().getDisplayName() + " followed by the past participle"
                    + (verb.pastParticiple() != null ? " (irregular for '" + verb.infinitive() + "')." : ".");
        }
        if (result.irregularForm()) {
            return "'" + verb.infinitive() + "' is irregular in the " + result.tense().getDisplayName() + ".";
        }
        if (result.stemChanged()) {
            return "'" + verb.infinitive() + "' is a stem-changing verb (" + verb.stemChangeVowel() + "→" + verb.stemChangeReplacement() + ").";
        }
        if (result.hasSpellingChange()) {
            return "Watch the spelling: " + result.spellingRule() + " in this form.";
        }

        return null;
    }

    private static String personReminder(Person person) {
        return "Conjugate for " + person.getPronounLabel() + " (" + person.getDisplayName() + ").";
    }
}
