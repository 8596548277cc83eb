package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

// Indicative counterparts of the subjunctive tenses. Only used to recognize mood confusion in answers
@Component
public class IndicativeReference {

    private final VerbLexicon lexicon;
    private final ConjugationEngine conjugationEngine;

    @Autowired
    public IndicativeReference(VerbLexicon lexicon, ConjugationEngine conjugationEngine) {
        this.lexicon = lexicon;
        this.conjugationEngine = conjugationEngine;
    }

    public Optional<String> indicativeCounterpart(Verb verb, Tense tense, Person person) {
        switch (tense) {
            case PresentSubjunctive:
                return Optional.of(presentIndicative(verb, person));
            case ImperfectSubjunctive:
                return Optional.of(imperfectIndicative(verb, person));
            case PresentPerfectSubjunctive:
            case PluperfectSubjunctive:
                Optional<Verb> auxiliary = lexicon.findVerb(VerbLexicon.AUXILIARY_VERB);
                if (auxiliary.isEmpty()) {
                    return Optional.empty();
                }

                String auxiliaryForm = tense == Tense.PresentPerfectSubjunctive
                        ? presentIndicative(auxiliary.get(), person)
                        : imperfectIndicative(auxiliary.get(), person);
                return Optional.of(auxiliaryForm + " " + conjugationEngine.pastParticiple(verb));
            default:
                return Optional.empty();
        }
    }

    public String presentIndicative(Verb verb, Person person) {
        String override = verb.presentIndicative().get(person);
        if (override != null) {
            return override;
        }

        String ending = EndingTable.presentIndicative(verb.conjugationClass(), person);
        if (person == Person.FirstSingular && verb.presentStem() != null) {
            return verb.presentStem() + ending;
        }

        String stem = StemRules.presentIndicativeStem(verb, StemRules.regularStem(verb), person);
        Optional<SpellingRule> rule = SpellingRule.find(verb.infinitive(), ending);
        if (rule.isPresent()) {
            stem = rule.get().apply(stem);
        }

        return stem + ending;
    }

    public String imperfectIndicative(Verb verb, Person person) {
        String override = verb.imperfectIndicative().get(person);
        if (override != null) {
            return override;
        }

        return StemRules.regularStem(verb) + EndingTable.imperfectIndicative(verb.conjugationClass(), person);
    }
}
