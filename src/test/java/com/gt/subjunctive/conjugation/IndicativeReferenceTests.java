package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.Person;
import com.gt.subjunctive.model.Tense;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class IndicativeReferenceTests {

    private static VerbLexicon lexicon;
    private static IndicativeReference indicativeReference;

    @BeforeAll
    public static void setup() {
        lexicon = VerbLexicon.loadDefault();
        indicativeReference = new IndicativeReference(lexicon, new ConjugationEngine(lexicon));
    }

    @Test
    public void testPresentIndicative() {
        assertEquals("hablo", present("hablar", Person.FirstSingular));
        assertEquals("vivimos", present("vivir", Person.FirstPlural));
        assertEquals("piensa", present("pensar", Person.ThirdSingular));
        assertEquals("pensamos", present("pensar", Person.FirstPlural));
        assertEquals("tengo", present("tener", Person.FirstSingular));
        assertEquals("tienes", present("tener", Person.SecondSingular));
        assertEquals("escojo", present("escoger", Person.FirstSingular));
        assertEquals("soy", present("ser", Person.FirstSingular));
        assertEquals("construyen", present("construir", Person.ThirdPlural));
    }

    @Test
    public void testImperfectIndicative() {
        assertEquals("hablaba", indicativeReference.imperfectIndicative(lexicon.getVerb("hablar"), Person.FirstSingular));
        assertEquals("comíamos", indicativeReference.imperfectIndicative(lexicon.getVerb("comer"), Person.FirstPlural));
        assertEquals("iba", indicativeReference.imperfectIndicative(lexicon.getVerb("ir"), Person.ThirdSingular));
    }

    @Test
    public void testIndicativeCounterpart() {
        assertEquals(Optional.of("piensa"),
                indicativeReference.indicativeCounterpart(lexicon.getVerb("pensar"), Tense.PresentSubjunctive, Person.ThirdSingular));
        assertEquals(Optional.of("hablaba"),
                indicativeReference.indicativeCounterpart(lexicon.getVerb("hablar"), Tense.ImperfectSubjunctive, Person.FirstSingular));
        assertEquals(Optional.of("han hecho"),
                indicativeReference.indicativeCounterpart(lexicon.getVerb("hacer"), Tense.PresentPerfectSubjunctive, Person.ThirdPlural));
        assertEquals(Optional.of("había comido"),
                indicativeReference.indicativeCounterpart(lexicon.getVerb("comer"), Tense.PluperfectSubjunctive, Person.FirstSingular));
    }

    private static String present(String infinitive, Person person) {
        return indicativeReference.presentIndicative(lexicon.getVerb(infinitive), person);
    }
}
