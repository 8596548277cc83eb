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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Entry point for a practice session: hands out exercises, grades answers and keeps the mastery
 * schedule current.
 * <p>
 * When an answer is submitted the attempt is stored and mastery is updated before any feedback
 * elaboration is requested, so a slow elaborator never delays or loses progress.
 */
@Component
public class PracticeService {

    private static final Logger log = LoggerFactory.getLogger(PracticeService.class);

    private final ExerciseGenerator exerciseGenerator;
    private final ExerciseDao exerciseDao;
    private final AttemptDao attemptDao;
    private final ValidationService validationService;
    private final FeedbackGenerator feedbackGenerator;
    private final MasteryTracker masteryTracker;
    private final DifficultyAdvisor difficultyAdvisor;
    private final int recentExclusionSize;
    private final int difficultyWindow;
    private final int maxAnswerLength;

    @Autowired
    public PracticeService(ExerciseGenerator exerciseGenerator,
                           ExerciseDao exerciseDao,
                           AttemptDao attemptDao,
                           ValidationService validationService,
                           FeedbackGenerator feedbackGenerator,
                           MasteryTracker masteryTracker,
                           DifficultyAdvisor difficultyAdvisor,
                           @Value("${subjunctive.exercise.recentExclusionSize:10}") int recentExclusionSize,
                           @Value("${subjunctive.exercise.difficultyWindow:20}") int difficultyWindow,
                           @Value("${subjunctive.practice.maxAnswerLength:256}") int maxAnswerLength) {
        this.exerciseGenerator = exerciseGenerator;
        this.exerciseDao = exerciseDao;
        this.attemptDao = attemptDao;
        this.validationService = validationService;
        this.feedbackGenerator = feedbackGenerator;
        this.masteryTracker = masteryTracker;
        this.difficultyAdvisor = difficultyAdvisor;
        this.recentExclusionSize = recentExclusionSize;
        this.difficultyWindow = difficultyWindow;
        this.maxAnswerLength = maxAnswerLength;
    }

    public Exercise getExercise(String userId, Set<String> verbs, Set<Tense> tenses, Difficulty difficulty, boolean adaptive) {
        Difficulty effectiveDifficulty = difficulty != null
                ? difficulty
                : difficultyAdvisor.recommend(exerciseDao.loadLatestDifficulty(userId).orElse(null),
                        attemptDao.loadRecentAttempts(userId, difficultyWindow));

        List<String> dueVerbs = adaptive ? masteryTracker.getDue(userId, Instant.now()) : List.of();
        Set<ExerciseKey> recentlySeen = exerciseDao.loadRecentExerciseKeys(userId, recentExclusionSize);

        Exercise exercise = exerciseGenerator.generate(
                new ExerciseCriteria(verbs, tenses, effectiveDifficulty, recentlySeen),
                new PracticeContext(userId, adaptive, dueVerbs));
        exerciseDao.saveExercise(exercise);

        log.debug("Generated exercise {} ({} {} {}) for user {}", exercise.id(), exercise.verb(), exercise.tense().getCode(),
                exercise.person().getCode(), userId);

        return exercise;
    }

    public AnswerResult submitAnswer(String exerciseId, String userId, String answer, Long elapsedTimeMs) {
        // Bounded by attempt.submitted_text
        if (answer.length() > maxAnswerLength) {
            String errMsg = "Answer for exercise " + exerciseId + " exceeds " + maxAnswerLength + " characters";

            log.warn(errMsg);
            throw new InvalidRequestException(errMsg);
        }

        Exercise exercise = loadExerciseForUser(exerciseId, userId);
        Instant attemptInstant = Instant.now();

        GradedAnswer gradedAnswer = validationService.gradeAnswer(exercise, answer);
        ValidationVerdict verdict = gradedAnswer.verdict();

        attemptDao.saveAttempt(new Attempt(UUID.randomUUID().toString(),
                userId,
                exercise.id(),
                exercise.verb(),
                answer,
                attemptInstant,
                verdict.correct(),
                verdict.errorKind(),
                elapsedTimeMs));
        MasteryRecord masteryRecord = masteryTracker.recordAttempt(userId, exercise.verb(), verdict.correct(), attemptInstant);

        Feedback feedback = feedbackGenerator.explainWithElaboration(verdict, exercise, gradedAnswer.result(), answer);

        return new AnswerResult(verdict.correct(),
                feedback.correctAnswer(),
                verdict.errorKind(),
                feedback,
                masteryTracker.summarize(masteryRecord));
    }

    public List<String> getDueReviewQueue(String userId, int limit) {
        List<String> due = masteryTracker.getDue(userId, Instant.now());

        return limit > 0 && due.size() > limit ? due.subList(0, limit) : due;
    }

    public List<MasterySummary> getMasterySummary(String userId) {
        return masteryTracker.getMasterySummary(userId);
    }

    public int resetMastery(String userId, Collection<String> verbs) {
        return masteryTracker.resetMastery(userId, verbs, Instant.now());
    }

    private Exercise loadExerciseForUser(String exerciseId, String userId) {
        Optional<Exercise> exercise = exerciseDao.loadExercise(exerciseId);

        if (exercise.isEmpty() || !exercise.get().userId().equals(userId)) {
            String errMsg = "Exercise " + exerciseId + " not found for user " + userId;

            log.error(errMsg);
            throw new ExerciseNotFoundException(errMsg);
        }

        return exercise.get();
    }
}
