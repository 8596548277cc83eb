package com.gt.subjunctive.exercise;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.Person;
import com.gt.subjunctive.model.Tense;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class HintBuilderTests {

    private static VerbLexicon lexicon;
    private static ConjugationEngine conjugationEngine;

    private final HintBuilder hintBuilder = new HintBuilder();

    @BeforeAll
    public static void setup() {
        lexicon = VerbLexicon.loadDefault();
        conjugationEngine = new ConjugationEngine(lexicon);
    }

    @Test
    public void testBuildHints_regular() {
        assertEquals(List.of("'hablar' means 'to speak'.", "Conjugate for yo (1st person singular)."), hints("hablar", Tense.PresentSubjunctive, Person.FirstSingular));
    }

    @Test
    public void testBuildHints_verbNotes() {
        assertEquals("'pensar' is a stem-changing verb (e→ie).", hints("pensar", Tense.PresentSubjunctive, Person.ThirdSingular).get(1));
        assertEquals("Watch the spelling: c→qu in this form.", hints("buscar", Tense.PresentSubjunctive, Person.FirstSingular).get(1));
        assertEquals("'hacer' is irregular in the present subjunctive.", hints("hacer", Tense.PresentSubjunctive, Person.FirstSingular).get(1));
        assertEquals("Use haber in the present subjunctive followed by the past participle (irregular for 'hacer').",
                hints("hacer", Tense.PresentPerfectSubjunctive, Person.ThirdPlural).get(1));
    }

    private List<String> hints(String infinitive, Tense tense, Person person) {
        return hintBuilder.buildHints(lexicon.getVerb(infinitive), conjugationEngine.conjugate(infinitive, tense, person));
    }
}
