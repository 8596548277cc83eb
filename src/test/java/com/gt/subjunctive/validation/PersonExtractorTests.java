package com.gt.subjunctive.validation;

import com.gt.subjunctive.exception.AmbiguousPersonException;
import com.gt.subjunctive.model.Person;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PersonExtractorTests {

    private final PersonExtractor personExtractor = new PersonExtractor();

    @Test
    public void testExtractPerson() {
        assertEquals(Person.FirstSingular, personExtractor.extractPerson("Es importante que yo ____ (hablar)."));
        assertEquals(Person.SecondSingular, personExtractor.extractPerson("Dudo que tú ____ (comer)."));
        assertEquals(Person.ThirdSingular, personExtractor.extractPerson("Ojalá que Usted ____ (vivir)."));
        assertEquals(Person.FirstPlural, personExtractor.extractPerson("Mi jefe exigía que nosotras ____ (trabajar)."));
        assertEquals(Person.SecondPlural, personExtractor.extractPerson("No creo que vosotros ____ (salir)."));
        assertEquals(Person.ThirdPlural, personExtractor.extractPerson("Me alegra que ellos ____ (venir)."));
    }

    @Test
    public void testExtractPerson_wholeWordsOnly() {
        // "tu" without accent is a possessive and "ellas" must not count as "ella"
        assertEquals(Person.ThirdPlural, personExtractor.extractPerson("Es mejor que ellas ____ (leer) tu libro."));
        assertEquals(Person.FirstSingular, personExtractor.extractPerson("Ojalá yo ____ (ver) a mi hermano."));
    }

    @Test
    public void testExtractPerson_ambiguous() {
        assertThrows(AmbiguousPersonException.class, () -> personExtractor.extractPerson("Es importante que ____ (hablar)."));
        assertThrows(AmbiguousPersonException.class, () -> personExtractor.extractPerson("Quiero que tú y él ____ (hablar)."));
        assertThrows(AmbiguousPersonException.class, () -> personExtractor.extractPerson(""));
        assertThrows(AmbiguousPersonException.class, () -> personExtractor.extractPerson(null));
    }
}
