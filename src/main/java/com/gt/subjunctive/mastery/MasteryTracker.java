package com.gt.subjunctive.mastery;

import com.gt.subjunctive.exception.DaoException;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.MasteryRecord;
import com.gt.subjunctive.model.MasterySummary;
import com.gt.subjunctive.model.Verb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class MasteryTracker {

    private static final Logger log = LoggerFactory.getLogger(MasteryTracker.class);

    private final MasteryDao masteryDao;
    private final MasteryScheduler masteryScheduler;
    private final VerbLexicon lexicon;
    private final int maxUpdateRetries;

    @Autowired
    public MasteryTracker(MasteryDao masteryDao,
                          MasteryScheduler masteryScheduler,
                          VerbLexicon lexicon,
                          @Value("${subjunctive.mastery.maxUpdateRetries:5}") int maxUpdateRetries) {
        this.masteryDao = masteryDao;
        this.masteryScheduler = masteryScheduler;
        this.lexicon = lexicon;
        this.maxUpdateRetries = maxUpdateRetries;
    }

    // Read-modify-write guarded by the record version. A lost race reloads and reapplies the attempt
    public MasteryRecord recordAttempt(String userId, String verb, boolean correct, Instant attemptInstant) {
        for (int tryCount = 1; tryCount <= maxUpdateRetries; tryCount++) {
            Optional<MasteryRecord> existing = masteryDao.loadMasteryRecord(userId, verb);
            MasteryRecord updated = masteryScheduler.applyAttempt(existing.orElse(null), userId, verb, correct, attemptInstant);

            boolean saved = existing.isPresent()
                    ? masteryDao.updateMasteryRecord(updated, existing.get().version())
                    : masteryDao.insertMasteryRecord(updated);
            if (saved) {
                return updated;
            }

            log.debug("Concurrent mastery update for user {} verb {} (try {} of {})", userId, verb, tryCount, maxUpdateRetries);
        }

        String errMsg = "Unable to update mastery for user " + userId + " verb " + verb + " after " + maxUpdateRetries + " tries";

        log.error(errMsg);
        throw new DaoException(errMsg);
    }

    // Verbs never practiced come first, then due verbs from the most overdue
    public List<String> getDue(String userId, Instant asOf) {
        Map<String, MasteryRecord> recordsByVerb = loadRecordsByVerb(userId);

        List<String> due = new ArrayList<>();
        for (Verb verb : lexicon.getVerbs()) {
            if (!recordsByVerb.containsKey(verb.infinitive())) {
                due.add(verb.infinitive());
            }
        }

        recordsByVerb.values().stream()
                .filter(masteryRecord -> lexicon.contains(masteryRecord.verb()))
                .filter(masteryRecord -> !masteryRecord.nextReviewInstant().isAfter(asOf))
                .sorted(Comparator.comparing(MasteryRecord::nextReviewInstant).thenComparing(MasteryRecord::verb))
                .forEach(masteryRecord -> due.add(masteryRecord.verb()));

        return due;
    }

    public List<MasterySummary> getMasterySummary(String userId) {
        return masteryDao.loadMasteryRecords(userId).stream()
                .map(this::summarize)
                .collect(Collectors.toList());
    }

    public MasterySummary summarize(MasteryRecord masteryRecord) {
        return new MasterySummary(masteryRecord.verb(),
                masteryScheduler.levelOf(masteryRecord),
                masteryRecord.consecutiveCorrect(),
                masteryRecord.totalAttempts(),
                masteryRecord.totalCorrect(),
                masteryRecord.currentInterval().toSeconds(),
                masteryRecord.nextReviewInstant());
    }

    // The one path that may schedule a review without an attempt behind it
    public int resetMastery(String userId, Collection<String> verbs, Instant resetInstant) {
        List<String> verbsToReset = verbs == null || verbs.isEmpty()
                ? new ArrayList<>(loadRecordsByVerb(userId).keySet())
                : new ArrayList<>(verbs);

        int rowsReset = masteryDao.resetMasteryRecords(userId, verbsToReset, resetInstant);
        log.info("Reset mastery of {} verbs for user {}", rowsReset, userId);

        return rowsReset;
    }

    private Map<String, MasteryRecord> loadRecordsByVerb(String userId) {
        return masteryDao.loadMasteryRecords(userId).stream()
                .collect(Collectors.toMap(MasteryRecord::verb, Function.identity(), (left, right) -> left, LinkedHashMap::new));
    }
}
