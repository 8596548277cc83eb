package com.gt.subjunctive.mastery;

import com.gt.subjunctive.model.MasteryLevel;
import com.gt.subjunctive.model.MasteryRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Review interval policy. A correct answer sets the interval to {@code base * growth^(streak - 1)},
 * capped at the maximum, so the interval never shrinks while the streak lasts. A miss resets the
 * streak and schedules a short retry, never later than the previous interval.
 */
@Component
public class MasteryScheduler {

    private final Duration baseInterval;
    private final double growthFactor;
    private final Duration maxInterval;
    private final Duration missInterval;
    private final Duration masteredInterval;
    private final int reviewingStreak;

    @Autowired
    public MasteryScheduler(@Value("${subjunctive.mastery.baseIntervalSec:14400}") long baseIntervalSec,
                            @Value("${subjunctive.mastery.growthFactor:2.0}") double growthFactor,
                            @Value("${subjunctive.mastery.maxIntervalSec:5184000}") long maxIntervalSec,
                            @Value("${subjunctive.mastery.missIntervalSec:600}") long missIntervalSec,
                            @Value("${subjunctive.mastery.masteredIntervalSec:1814400}") long masteredIntervalSec,
                            @Value("${subjunctive.mastery.reviewingStreak:2}") int reviewingStreak) {
        this.baseInterval = Duration.ofSeconds(baseIntervalSec);
        this.growthFactor = growthFactor;
        this.maxInterval = Duration.ofSeconds(maxIntervalSec);
        this.missInterval = Duration.ofSeconds(missIntervalSec);
        this.masteredInterval = Duration.ofSeconds(masteredIntervalSec);
        this.reviewingStreak = reviewingStreak;
    }

    public Duration intervalAfterCorrect(int consecutiveCorrect) {
        double seconds = baseInterval.toSeconds() * Math.pow(growthFactor, Math.max(0, consecutiveCorrect - 1));
        if (seconds >= maxInterval.toSeconds()) {
            return maxInterval;
        }

        return Duration.ofSeconds(Math.round(seconds));
    }

    public Duration getMissInterval() {
        return missInterval;
    }

    // A reset record carries a zero interval, so a miss right after a reset still waits the full miss interval
    Duration intervalAfterMiss(MasteryRecord previous) {
        if (previous == null || previous.currentInterval().isZero() || previous.currentInterval().isNegative()) {
            return missInterval;
        }

        return previous.currentInterval().compareTo(missInterval) < 0 ? previous.currentInterval() : missInterval;
    }

    // previous is null for the first attempt on a verb
    public MasteryRecord applyAttempt(MasteryRecord previous, String userId, String verb, boolean correct, Instant attemptInstant) {
        int previousStreak = previous == null ? 0 : previous.consecutiveCorrect();
        int totalAttempts = previous == null ? 1 : previous.totalAttempts() + 1;
        int totalCorrect = (previous == null ? 0 : previous.totalCorrect()) + (correct ? 1 : 0);

        int consecutiveCorrect = correct ? previousStreak + 1 : 0;
        Duration interval = correct ? intervalAfterCorrect(consecutiveCorrect) : intervalAfterMiss(previous);

        return new MasteryRecord(userId,
                verb,
                consecutiveCorrect,
                totalAttempts,
                totalCorrect,
                interval,
                attemptInstant.plus(interval),
                correct,
                attemptInstant,
                previous == null ? 0 : previous.version() + 1);
    }

    public MasteryLevel levelOf(MasteryRecord masteryRecord) {
        if (masteryRecord == null || masteryRecord.totalAttempts() == 0) {
            return MasteryLevel.New;
        }
        if (masteryRecord.consecutiveCorrect() > 0 && masteryRecord.currentInterval().compareTo(masteredInterval) >= 0) {
            return MasteryLevel.Mastered;
        }
        if (masteryRecord.consecutiveCorrect() >= reviewingStreak) {
            return MasteryLevel.Reviewing;
        }

        return MasteryLevel.Learning;
    }
}
