package com.gt.subjunctive.task;

import com.gt.subjunctive.exercise.ExerciseDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class DatabaseMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMaintenanceTask.class);

    private final ExerciseDao exerciseDao;
    private final int purgeUnattemptedAfterDays;

    public DatabaseMaintenanceTask(ExerciseDao exerciseDao,
                                   @Value("${subjunctive.maintenance.purgeUnattemptedAfterDays:7}") int purgeUnattemptedAfterDays) {
        this.exerciseDao = exerciseDao;
        this.purgeUnattemptedAfterDays = purgeUnattemptedAfterDays;
    }

    @Scheduled(cron = "@daily")
    public void performDatabaseMaintenance() {
        purgeUnattemptedExercises();
    }

    void purgeUnattemptedExercises() {
        Instant cutoff = Instant.now().minus(purgeUnattemptedAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = exerciseDao.purgeUnattemptedExercises(cutoff);

        log.info("Purged unattempted exercises. {} rows deleted.", rowsDeleted);
    }
}
