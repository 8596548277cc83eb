package com.gt.subjunctive.validation;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.conjugation.IndicativeReference;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Grades a free-text answer against the engine's result for one (verb, tense, person).
 * <p>
 * Wrong answers are classified in a fixed order: another subjunctive tense of the same person,
 * another person of the same tense, an answer that keeps the stem but not the ending, the indicative,
 * an answer that keeps the ending but not the stem, and finally anything else.
 */
@Component
public class AnswerValidator {

    private static final Logger log = LoggerFactory.getLogger(AnswerValidator.class);

    static final int NEAR_MISS_DISTANCE = 2;

    private final VerbLexicon lexicon;
    private final ConjugationEngine conjugationEngine;
    private final IndicativeReference indicativeReference;

    @Autowired
    public AnswerValidator(VerbLexicon lexicon, ConjugationEngine conjugationEngine, IndicativeReference indicativeReference) {
        this.lexicon = lexicon;
        this.conjugationEngine = conjugationEngine;
        this.indicativeReference = indicativeReference;
    }

    public ValidationVerdict validate(String answer, ConjugationResult expected, boolean accentInsensitive) {
        String normalized = AnswerNormalizer.normalize(answer);
        List<String> acceptedForms = expected.acceptedForms();

        for (String form : acceptedForms) {
            if (AnswerNormalizer.normalize(form).equals(normalized)) {
                return ValidationVerdict.correct(form, false);
            }
        }

        String folded = AnswerNormalizer.fold(normalized);
        for (String form : acceptedForms) {
            if (AnswerNormalizer.normalizeAndFold(form).equals(folded)) {
                if (accentInsensitive) {
                    return ValidationVerdict.correct(form, true);
                }

                return ValidationVerdict.incorrect(ErrorKind.AccentOnly, false, true);
            }
        }

        if (folded.isEmpty()) {
            return ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false);
        }

        boolean nearMiss = FormFuzzyMatcher.findClosest(folded, foldAll(acceptedForms), NEAR_MISS_DISTANCE).isPresent();

        ValidationVerdict verdict = classify(folded, expected, nearMiss);
        log.debug("Answer '{}' for {} {} {} classified as {}", normalized, expected.verb(), expected.tense().getCode(),
                expected.person().getCode(), verdict.errorKind().getCode());

        return verdict;
    }

    // Stored-answer comparison for exercises whose person cannot be recovered
    public ValidationVerdict validateAgainstStored(String answer, String correctAnswer, Collection<String> alternates, boolean accentInsensitive) {
        String normalized = AnswerNormalizer.normalize(answer);

        List<String> storedForms = new ArrayList<>();
        storedForms.add(correctAnswer);
        storedForms.addAll(alternates);

        for (String form : storedForms) {
            if (AnswerNormalizer.normalize(form).equals(normalized)) {
                return ValidationVerdict.correct(form, false).asDegraded();
            }
        }

        String folded = AnswerNormalizer.fold(normalized);
        for (String form : storedForms) {
            if (AnswerNormalizer.normalizeAndFold(form).equals(folded)) {
                return accentInsensitive
                        ? ValidationVerdict.correct(form, true).asDegraded()
                        : ValidationVerdict.incorrect(ErrorKind.AccentOnly, false, true).asDegraded();
            }
        }

        return ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false).asDegraded();
    }

    private ValidationVerdict classify(String folded, ConjugationResult expected, boolean nearMiss) {
        Verb verb = lexicon.getVerb(expected.verb());

        for (Tense tense : Tense.values()) {
            if (tense != expected.tense()
                    && conjugationEngine.supports(verb.infinitive(), tense, expected.person())
                    && matchesAny(folded, conjugationEngine.conjugate(verb, tense, expected.person()))) {
                return ValidationVerdict.incorrect(ErrorKind.WrongMoodOrTense, false, nearMiss);
            }
        }

        for (Person person : Person.values()) {
            if (person != expected.person() && matchesAny(folded, conjugationEngine.conjugate(verb, expected.tense(), person))) {
                return ValidationVerdict.incorrect(ErrorKind.WrongPerson, false, nearMiss);
            }
        }

        Optional<String> indicative = indicativeReference.indicativeCounterpart(verb, expected.tense(), expected.person());
        boolean indicativeForm = indicative.isPresent() && AnswerNormalizer.normalizeAndFold(indicative.get()).equals(folded);

        // Compound stems end with the separating space, so the split must not be trimmed
        String stem = AnswerNormalizer.fold(expected.stem().toLowerCase(Locale.ROOT));
        if (!stem.isBlank() && folded.startsWith(stem)) {
            return ValidationVerdict.incorrect(ErrorKind.WrongEnding, indicativeForm, nearMiss);
        }

        if (indicativeForm) {
            return ValidationVerdict.incorrect(ErrorKind.WrongMoodOrTense, true, nearMiss);
        }

        String ending = AnswerNormalizer.fold(expected.ending().toLowerCase(Locale.ROOT));
        if (!ending.isEmpty() && folded.endsWith(ending)) {
            return ValidationVerdict.incorrect(ErrorKind.WrongStem, false, nearMiss);
        }

        return ValidationVerdict.incorrect(ErrorKind.Mismatch, false, nearMiss);
    }

    private static boolean matchesAny(String folded, ConjugationResult result) {
        for (String form : result.acceptedForms()) {
            if (AnswerNormalizer.normalizeAndFold(form).equals(folded)) {
                return true;
            }
        }

        return false;
    }

    private static List<String> foldAll(Collection<String> forms) {
        return forms.stream().map(AnswerNormalizer::normalizeAndFold).collect(Collectors.toList());
    }
}
