package com.gt.subjunctive.exercise;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.exception.NoEligibleExerciseException;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ExerciseGeneratorTests {

    private static final String TEST_USER_ID = "testUser";
    private static final PracticeContext NON_ADAPTIVE = new PracticeContext(TEST_USER_ID, false, List.of());

    private VerbLexicon lexicon;
    private ConjugationEngine conjugationEngine;
    private ExerciseGenerator exerciseGenerator;

    @BeforeEach
    public void setup() {
        lexicon = VerbLexicon.loadDefault();
        conjugationEngine = new ConjugationEngine(lexicon);
        exerciseGenerator = new ExerciseGenerator(lexicon, conjugationEngine, new HintBuilder(), new Random(42), 3.0);
    }

    @Test
    public void testGenerate_beginner() {
        for (int i = 0; i < 50; i++) {
            Exercise exercise = exerciseGenerator.generate(ExerciseCriteria.unfiltered(Difficulty.Beginner), NON_ADAPTIVE);

            assertEquals(Tense.PresentSubjunctive, exercise.tense());
            assertFalse(lexicon.getVerb(exercise.verb()).isIrregular());
            assertEquals(Difficulty.Beginner, exercise.difficulty());
        }
    }

    @Test
    public void testGenerate_exercise() {
        ExerciseCriteria criteria = new ExerciseCriteria(Set.of("hacer"), Set.of(Tense.ImperfectSubjunctive), Difficulty.Advanced, Set.of());

        Exercise exercise = exerciseGenerator.generate(criteria, NON_ADAPTIVE);
        ConjugationResult expected = conjugationEngine.conjugate("hacer", Tense.ImperfectSubjunctive, exercise.person());

        assertNotNull(exercise.id());
        assertEquals(TEST_USER_ID, exercise.userId());
        assertEquals("hacer", exercise.verb());
        assertEquals(expected.canonical(), exercise.correctAnswer());
        assertEquals(expected.alternates(), exercise.alternates());
        assertTrue(exercise.prompt().startsWith(exercise.triggerPhrase() + " "));
        assertTrue(exercise.prompt().endsWith(" ____ (hacer)."));
        assertTrue(exercise.person().getPronouns().stream().anyMatch(pronoun -> exercise.prompt().contains(" " + pronoun + " ")));
        assertTrue(TriggerCategory.fromCode(exercise.triggerCategory()).getTriggers(true).contains(exercise.triggerPhrase()));
        assertNotNull(exercise.context());
        assertEquals(3, exercise.hints().size());
    }

    @Test
    public void testGenerate_nullDifficultyMeansAdvanced() {
        ExerciseCriteria criteria = new ExerciseCriteria(Set.of("caber"), Set.of(Tense.PluperfectSubjunctive), null, Set.of());

        Exercise exercise = exerciseGenerator.generate(criteria, NON_ADAPTIVE);

        assertEquals("caber", exercise.verb());
        assertEquals(Difficulty.Advanced, exercise.difficulty());
    }

    @Test
    public void testGenerate_noEligibleExercise() {
        assertThrows(NoEligibleExerciseException.class, () -> exerciseGenerator.generate(
                new ExerciseCriteria(Set.of("caber"), Set.of(), Difficulty.Intermediate, Set.of()), NON_ADAPTIVE));
        assertThrows(NoEligibleExerciseException.class, () -> exerciseGenerator.generate(
                new ExerciseCriteria(Set.of(), Set.of(Tense.PluperfectSubjunctive), Difficulty.Beginner, Set.of()), NON_ADAPTIVE));
        assertThrows(NoEligibleExerciseException.class, () -> exerciseGenerator.generate(
                new ExerciseCriteria(Set.of("blorpar"), Set.of(), Difficulty.Advanced, Set.of()), NON_ADAPTIVE));
    }

    @Test
    public void testGenerate_excludesRecentlySeen() {
        Set<ExerciseKey> recentlySeen = Arrays.stream(Person.values())
                .filter(person -> person != Person.FirstPlural)
                .map(person -> new ExerciseKey("hablar", Tense.PresentSubjunctive, person))
                .collect(Collectors.toSet());
        ExerciseCriteria criteria = new ExerciseCriteria(Set.of("hablar"), Set.of(Tense.PresentSubjunctive), Difficulty.Beginner, recentlySeen);

        for (int i = 0; i < 20; i++) {
            assertEquals(Person.FirstPlural, exerciseGenerator.generate(criteria, NON_ADAPTIVE).person());
        }
    }

    @Test
    public void testGenerate_allRecentlySeenAllowsRepeats() {
        Set<ExerciseKey> recentlySeen = Arrays.stream(Person.values())
                .map(person -> new ExerciseKey("hablar", Tense.PresentSubjunctive, person))
                .collect(Collectors.toSet());
        ExerciseCriteria criteria = new ExerciseCriteria(Set.of("hablar"), Set.of(Tense.PresentSubjunctive), Difficulty.Beginner, recentlySeen);

        Exercise exercise = exerciseGenerator.generate(criteria, NON_ADAPTIVE);

        assertEquals("hablar", exercise.verb());
    }

    @Test
    public void testGenerate_adaptivePrefersDueVerbs() {
        ExerciseGenerator weightedGenerator = new ExerciseGenerator(lexicon, conjugationEngine, new HintBuilder(), new Random(7), 1_000_000);
        ExerciseCriteria criteria = new ExerciseCriteria(Set.of("hablar", "comer", "vivir"), Set.of(), Difficulty.Beginner, Set.of());
        PracticeContext context = new PracticeContext(TEST_USER_ID, true, List.of("comer"));

        Map<String, Integer> verbCounts = new HashMap<>();
        for (int i = 0; i < 100; i++) {
            verbCounts.merge(weightedGenerator.generate(criteria, context).verb(), 1, Integer::sum);
        }

        assertTrue(verbCounts.getOrDefault("comer", 0) >= 99);
    }

    @Test
    public void testFindCandidates() {
        Map<Verb, List<ExerciseKey>> candidates = exerciseGenerator.findCandidates(ExerciseCriteria.unfiltered(Difficulty.Intermediate), Difficulty.Intermediate);
        Set<String> verbs = candidates.keySet().stream().map(Verb::infinitive).collect(Collectors.toSet());

        assertTrue(verbs.contains("hablar"));
        assertTrue(verbs.contains("ser"));
        assertTrue(verbs.contains("pensar"));
        assertFalse(verbs.contains("caber"));
        assertEquals(18, candidates.get(lexicon.getVerb("hablar")).size());
    }

    @Test
    public void testTensesFor() {
        assertEquals(EnumSet.of(Tense.PresentSubjunctive), ExerciseGenerator.tensesFor(Difficulty.Beginner));
        assertEquals(EnumSet.allOf(Tense.class), ExerciseGenerator.tensesFor(Difficulty.Advanced));
    }
}
