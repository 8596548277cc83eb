package com.gt.subjunctive.feedback;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class FeedbackGeneratorTests {

    private static final long ELABORATION_TIMEOUT_MS = 200;

    private static ConjugationEngine conjugationEngine;

    private ExecutorService feedbackExecutor;
    private FeedbackGenerator feedbackGenerator;

    @Mock private FeedbackElaborator feedbackElaborator;

    @BeforeAll
    public static void setupEngine() {
        conjugationEngine = new ConjugationEngine(VerbLexicon.loadDefault());
    }

    @BeforeEach
    public void setup() {
        feedbackExecutor = Executors.newFixedThreadPool(2);
        feedbackGenerator = new FeedbackGenerator(feedbackElaborator, feedbackExecutor, ELABORATION_TIMEOUT_MS);

        when(feedbackElaborator.isEnabled()).thenReturn(true);
    }

    @AfterEach
    public void teardown() {
        feedbackExecutor.shutdownNow();
    }

    @Test
    public void testExplain_correct() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstSingular);

        Feedback feedback = feedbackGenerator.explain(ValidationVerdict.correct("hable", false), exercise(result), result);

        assertEquals("Correct!", feedback.headline());
        assertEquals("hable", feedback.correctAnswer());
        assertEquals(result.ruleExplanation(), feedback.ruleExplanation());
        assertTrue(feedback.suggestions().isEmpty());
    }

    @Test
    public void testExplain_accentWarning() {
        ConjugationResult result = conjugate("estar", Tense.PresentSubjunctive, Person.ThirdPlural);

        Feedback feedback = feedbackGenerator.explain(ValidationVerdict.correct("estén", true), exercise(result), result);

        assertEquals("Correct, but check the accent.", feedback.headline());
        assertTrue(feedback.explanation().contains("estén"));
    }

    @Test
    public void testExplain_indicative() {
        ConjugationResult result = conjugate("hacer", Tense.PresentPerfectSubjunctive, Person.ThirdPlural);
        Exercise exercise = exercise(result);

        Feedback feedback = feedbackGenerator.explain(ValidationVerdict.incorrect(ErrorKind.WrongMoodOrTense, true, false), exercise, result);

        assertEquals("That is the indicative, not the subjunctive.", feedback.headline());
        assertTrue(feedback.explanation().contains(exercise.triggerPhrase()));
        assertTrue(feedback.explanation().contains("hayan hecho"));
        assertFalse(feedback.suggestions().isEmpty());
    }

    @Test
    public void testExplain_wrongPerson() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstPlural);

        Feedback feedback = feedbackGenerator.explain(ValidationVerdict.incorrect(ErrorKind.WrongPerson, false, true), exercise(result), result);

        assertEquals("Right verb form, wrong person.", feedback.headline());
        assertTrue(feedback.explanation().contains("nosotros/nosotras"));
    }

    @Test
    public void testExplain_withoutConjugationResult() {
        ConjugationResult result = conjugate("comer", Tense.ImperfectSubjunctive, Person.ThirdPlural);
        Exercise exercise = exercise(result);

        Feedback feedback = feedbackGenerator.explain(ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false).asDegraded(), exercise, null);

        assertEquals("comieran", feedback.correctAnswer());
        assertNull(feedback.ruleExplanation());
    }

    @Test
    public void testExplainWithElaboration() {
        ConjugationResult result = conjugate("pensar", Tense.PresentSubjunctive, Person.ThirdSingular);
        when(feedbackElaborator.elaborate(anyString())).thenReturn(" Use the subjunctive after 'es importante que'. ");

        Feedback feedback = feedbackGenerator.explainWithElaboration(
                ValidationVerdict.incorrect(ErrorKind.WrongEnding, true, true), exercise(result), result, "piensa");

        assertEquals(" Use the subjunctive after 'es importante que'. ", feedback.elaboration());
        verify(feedbackElaborator).elaborate(argThat(prompt -> prompt.contains("piensa") && prompt.contains("piense")));
    }

    @Test
    public void testExplainWithElaboration_correctAnswerSkipsElaborator() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstSingular);

        Feedback feedback = feedbackGenerator.explainWithElaboration(ValidationVerdict.correct("hable", false), exercise(result), result, "hable");

        assertNull(feedback.elaboration());
        verify(feedbackElaborator, never()).elaborate(anyString());
    }

    @Test
    public void testExplainWithElaboration_disabled() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstSingular);
        when(feedbackElaborator.isEnabled()).thenReturn(false);

        Feedback feedback = feedbackGenerator.explainWithElaboration(
                ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false), exercise(result), result, "xyz");

        assertNull(feedback.elaboration());
        assertEquals("hable", feedback.correctAnswer());
        verify(feedbackElaborator, never()).elaborate(anyString());
    }

    @Test
    public void testExplainWithElaboration_timeout() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstSingular);
        when(feedbackElaborator.elaborate(anyString())).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return "too late";
        });

        Instant start = Instant.now();
        Feedback feedback = feedbackGenerator.explainWithElaboration(
                ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false), exercise(result), result, "xyz");

        assertNull(feedback.elaboration());
        assertEquals("Not quite.", feedback.headline());
        assertTrue(Duration.between(start, Instant.now()).toMillis() < 3000);
    }

    @Test
    public void testExplainWithElaboration_failure() {
        ConjugationResult result = conjugate("hablar", Tense.PresentSubjunctive, Person.FirstSingular);
        when(feedbackElaborator.elaborate(anyString())).thenThrow(new IllegalStateException("service unavailable"));

        Feedback feedback = feedbackGenerator.explainWithElaboration(
                ValidationVerdict.incorrect(ErrorKind.Mismatch, true, false), exercise(result), result, "xyz");

        assertNull(feedback.elaboration());
        assertEquals("hable", feedback.correctAnswer());
    }

    private static ConjugationResult conjugate(String infinitive, Tense tense, Person person) {
        return conjugationEngine.conjugate(infinitive, tense, person);
    }

    private static Exercise exercise(ConjugationResult result) {
        return new Exercise("exercise-1", "testUser", result.verb(), result.tense(), result.person(), "Es importante que",
                "impersonal-expressions", "", "Es importante que " + result.person().getPronouns().get(0) + " ____ (" + result.verb() + ").",
                result.canonical(), result.alternates(), Difficulty.Advanced, List.of(), Instant.now());
    }
}
