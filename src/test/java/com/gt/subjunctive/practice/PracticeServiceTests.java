package com.gt.subjunctive.practice;

import com.gt.subjunctive.attempt.AttemptDao;
import com.gt.subjunctive.exception.ExerciseNotFoundException;
import com.gt.subjunctive.exception.InvalidRequestException;
import com.gt.subjunctive.exercise.DifficultyAdvisor;
import com.gt.subjunctive.exercise.ExerciseDao;
import com.gt.subjunctive.exercise.ExerciseGenerator;
import com.gt.subjunctive.feedback.FeedbackGenerator;
import com.gt.subjunctive.mastery.MasteryTracker;
import com.gt.subjunctive.model.*;
import com.gt.subjunctive.validation.ValidationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class PracticeServiceTests {

    private static final String TEST_USER_ID = "testUser";
    private static final int RECENT_EXCLUSION_SIZE = 10;
    private static final int DIFFICULTY_WINDOW = 20;
    private static final int MAX_ANSWER_LENGTH = 256;

    private static final Exercise TEST_EXERCISE = new Exercise(
            UUID.randomUUID().toString(),
            TEST_USER_ID,
            "pensar",
            Tense.PresentSubjunctive,
            Person.ThirdSingular,
            "Es importante que",
            "impersonal-expressions",
            "Planning a weekend trip.",
            "Es importante que ella ____ (pensar).",
            "piense",
            List.of(),
            Difficulty.Intermediate,
            List.of("'pensar' means 'to think'."),
            Instant.now());

    private PracticeService practiceService;

    @Mock private ExerciseGenerator exerciseGenerator;
    @Mock private ExerciseDao exerciseDao;
    @Mock private AttemptDao attemptDao;
    @Mock private ValidationService validationService;
    @Mock private FeedbackGenerator feedbackGenerator;
    @Mock private MasteryTracker masteryTracker;
    @Mock private DifficultyAdvisor difficultyAdvisor;

    @BeforeEach
    public void setup() {
        practiceService = new PracticeService(exerciseGenerator, exerciseDao, attemptDao, validationService, feedbackGenerator,
                masteryTracker, difficultyAdvisor, RECENT_EXCLUSION_SIZE, DIFFICULTY_WINDOW, MAX_ANSWER_LENGTH);
    }

    @Test
    public void testGetExercise_adaptive() {
        Set<ExerciseKey> recentlySeen = Set.of(new ExerciseKey("hablar", Tense.PresentSubjunctive, Person.FirstSingular));
        List<Attempt> recentAttempts = List.of();
        when(exerciseDao.loadLatestDifficulty(TEST_USER_ID)).thenReturn(Optional.of(Difficulty.Intermediate));
        when(attemptDao.loadRecentAttempts(TEST_USER_ID, DIFFICULTY_WINDOW)).thenReturn(recentAttempts);
        when(difficultyAdvisor.recommend(Difficulty.Intermediate, recentAttempts)).thenReturn(Difficulty.Advanced);
        when(masteryTracker.getDue(eq(TEST_USER_ID), any())).thenReturn(List.of("pensar", "comer"));
        when(exerciseDao.loadRecentExerciseKeys(TEST_USER_ID, RECENT_EXCLUSION_SIZE)).thenReturn(recentlySeen);
        when(exerciseGenerator.generate(any(), any())).thenReturn(TEST_EXERCISE);

        Exercise exercise = practiceService.getExercise(TEST_USER_ID, Set.of(), Set.of(), null, true);

        assertEquals(TEST_EXERCISE, exercise);

        ArgumentCaptor<ExerciseCriteria> criteriaCaptor = ArgumentCaptor.forClass(ExerciseCriteria.class);
        ArgumentCaptor<PracticeContext> contextCaptor = ArgumentCaptor.forClass(PracticeContext.class);
        verify(exerciseGenerator).generate(criteriaCaptor.capture(), contextCaptor.capture());

        assertEquals(Difficulty.Advanced, criteriaCaptor.getValue().difficulty());
        assertEquals(recentlySeen, criteriaCaptor.getValue().recentlySeen());
        assertEquals(new PracticeContext(TEST_USER_ID, true, List.of("pensar", "comer")), contextCaptor.getValue());
        verify(exerciseDao).saveExercise(TEST_EXERCISE);
    }

    @Test
    public void testGetExercise_explicitDifficulty() {
        when(exerciseDao.loadRecentExerciseKeys(TEST_USER_ID, RECENT_EXCLUSION_SIZE)).thenReturn(Set.of());
        when(exerciseGenerator.generate(any(), any())).thenReturn(TEST_EXERCISE);

        practiceService.getExercise(TEST_USER_ID, Set.of("pensar"), Set.of(Tense.PresentSubjunctive), Difficulty.Beginner, false);

        ArgumentCaptor<ExerciseCriteria> criteriaCaptor = ArgumentCaptor.forClass(ExerciseCriteria.class);
        verify(exerciseGenerator).generate(criteriaCaptor.capture(), eq(new PracticeContext(TEST_USER_ID, false, List.of())));
        assertEquals(new ExerciseCriteria(Set.of("pensar"), Set.of(Tense.PresentSubjunctive), Difficulty.Beginner, Set.of()), criteriaCaptor.getValue());

        verify(difficultyAdvisor, never()).recommend(any(), any());
        verify(masteryTracker, never()).getDue(anyString(), any());
    }

    @Test
    public void testSubmitAnswer() {
        ValidationVerdict verdict = ValidationVerdict.incorrect(ErrorKind.WrongEnding, true, true);
        Feedback feedback = new Feedback("Check the ending.", "The stem is right but the ending is not.", null, "piense", List.of(), "elaborated");
        MasteryRecord masteryRecord = new MasteryRecord(TEST_USER_ID, "pensar", 0, 1, 0, Duration.ofMinutes(10), Instant.now(), false, Instant.now(), 0);
        MasterySummary masterySummary = new MasterySummary("pensar", MasteryLevel.Learning, 0, 1, 0, 600, masteryRecord.nextReviewInstant());

        when(exerciseDao.loadExercise(TEST_EXERCISE.id())).thenReturn(Optional.of(TEST_EXERCISE));
        when(validationService.gradeAnswer(TEST_EXERCISE, "piensa")).thenReturn(new GradedAnswer(verdict, null));
        when(masteryTracker.recordAttempt(eq(TEST_USER_ID), eq("pensar"), eq(false), any())).thenReturn(masteryRecord);
        when(masteryTracker.summarize(masteryRecord)).thenReturn(masterySummary);
        when(feedbackGenerator.explainWithElaboration(verdict, TEST_EXERCISE, null, "piensa")).thenReturn(feedback);

        AnswerResult answerResult = practiceService.submitAnswer(TEST_EXERCISE.id(), TEST_USER_ID, "piensa", 4200L);

        assertFalse(answerResult.correct());
        assertEquals("piense", answerResult.correctAnswer());
        assertEquals(ErrorKind.WrongEnding, answerResult.errorKind());
        assertEquals(feedback, answerResult.feedback());
        assertEquals(masterySummary, answerResult.mastery());

        ArgumentCaptor<Attempt> attemptCaptor = ArgumentCaptor.forClass(Attempt.class);
        InOrder inOrder = inOrder(attemptDao, masteryTracker, feedbackGenerator);
        inOrder.verify(attemptDao).saveAttempt(attemptCaptor.capture());
        inOrder.verify(masteryTracker).recordAttempt(eq(TEST_USER_ID), eq("pensar"), eq(false), any());
        inOrder.verify(feedbackGenerator).explainWithElaboration(verdict, TEST_EXERCISE, null, "piensa");

        Attempt attempt = attemptCaptor.getValue();
        assertEquals(TEST_EXERCISE.id(), attempt.exerciseId());
        assertEquals("piensa", attempt.submittedText());
        assertEquals(ErrorKind.WrongEnding, attempt.errorKind());
        assertEquals(4200L, attempt.elapsedTimeMs());
    }

    @Test
    public void testSubmitAnswer_exerciseNotFound() {
        when(exerciseDao.loadExercise("missing")).thenReturn(Optional.empty());
        when(exerciseDao.loadExercise(TEST_EXERCISE.id())).thenReturn(Optional.of(TEST_EXERCISE));

        assertThrows(ExerciseNotFoundException.class, () -> practiceService.submitAnswer("missing", TEST_USER_ID, "piense", null));
        assertThrows(ExerciseNotFoundException.class, () -> practiceService.submitAnswer(TEST_EXERCISE.id(), "someoneElse", "piense", null));

        verify(attemptDao, never()).saveAttempt(any());
        verify(masteryTracker, never()).recordAttempt(anyString(), anyString(), anyBoolean(), any());
    }

    @Test
    public void testSubmitAnswer_answerTooLong() {
        when(exerciseDao.loadExercise(TEST_EXERCISE.id())).thenReturn(Optional.of(TEST_EXERCISE));

        String longAnswer = "piense ".repeat(40);
        assertThrows(InvalidRequestException.class, () -> practiceService.submitAnswer(TEST_EXERCISE.id(), TEST_USER_ID, longAnswer, null));

        verify(validationService, never()).gradeAnswer(any(), anyString());
        verify(attemptDao, never()).saveAttempt(any());
        verify(masteryTracker, never()).recordAttempt(anyString(), anyString(), anyBoolean(), any());
    }

    @Test
    public void testSubmitAnswer_answerAtMaxLength() {
        String answer = "a".repeat(MAX_ANSWER_LENGTH);
        ValidationVerdict verdict = ValidationVerdict.incorrect(ErrorKind.Mismatch, false, false);
        Feedback feedback = new Feedback("Not quite.", "The correct form is 'piense'.", null, "piense", List.of(), null);
        MasteryRecord masteryRecord = new MasteryRecord(TEST_USER_ID, "pensar", 0, 1, 0, Duration.ofMinutes(10), Instant.now(), false, Instant.now(), 0);

        when(exerciseDao.loadExercise(TEST_EXERCISE.id())).thenReturn(Optional.of(TEST_EXERCISE));
        when(validationService.gradeAnswer(TEST_EXERCISE, answer)).thenReturn(new GradedAnswer(verdict, null));
        when(masteryTracker.recordAttempt(eq(TEST_USER_ID), eq("pensar"), eq(false), any())).thenReturn(masteryRecord);
        when(feedbackGenerator.explainWithElaboration(verdict, TEST_EXERCISE, null, answer)).thenReturn(feedback);

        AnswerResult answerResult = practiceService.submitAnswer(TEST_EXERCISE.id(), TEST_USER_ID, answer, null);

        assertFalse(answerResult.correct());
        verify(attemptDao).saveAttempt(any());
    }

    @Test
    public void testGetDueReviewQueue() {
        when(masteryTracker.getDue(eq(TEST_USER_ID), any())).thenReturn(List.of("hablar", "comer", "vivir"));

        assertEquals(List.of("hablar", "comer"), practiceService.getDueReviewQueue(TEST_USER_ID, 2));
        assertEquals(List.of("hablar", "comer", "vivir"), practiceService.getDueReviewQueue(TEST_USER_ID, 0));
    }

    @Test
    public void testResetMastery() {
        when(masteryTracker.resetMastery(eq(TEST_USER_ID), eq(List.of("hablar")), any())).thenReturn(1);

        assertEquals(1, practiceService.resetMastery(TEST_USER_ID, List.of("hablar")));
    }
}
