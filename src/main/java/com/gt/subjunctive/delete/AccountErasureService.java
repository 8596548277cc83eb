package com.gt.subjunctive.delete;

import com.gt.subjunctive.attempt.AttemptDao;
import com.gt.subjunctive.exercise.ExerciseDao;
import com.gt.subjunctive.mastery.MasteryDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

// Removes everything stored for a user. Attempts reference exercises, so they go first
@Component
public class AccountErasureService {

    private static final Logger log = LoggerFactory.getLogger(AccountErasureService.class);

    private final AttemptDao attemptDao;
    private final ExerciseDao exerciseDao;
    private final MasteryDao masteryDao;

    @Autowired
    public AccountErasureService(AttemptDao attemptDao, ExerciseDao exerciseDao, MasteryDao masteryDao) {
        this.attemptDao = attemptDao;
        this.exerciseDao = exerciseDao;
        this.masteryDao = masteryDao;
    }

    public void eraseUser(String userId) {
        int attempts = attemptDao.deleteAttemptsForUser(userId);
        int exercises = exerciseDao.deleteExercisesForUser(userId);
        int masteryRecords = masteryDao.deleteMasteryRecordsForUser(userId);

        log.info("Erased user {}: {} attempts, {} exercises, {} mastery records", userId, attempts, exercises, masteryRecords);
    }
}
