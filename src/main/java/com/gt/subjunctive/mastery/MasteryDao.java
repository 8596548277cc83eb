package com.gt.subjunctive.mastery;

import com.gt.subjunctive.model.MasteryRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MasteryDao {

    Optional<MasteryRecord> loadMasteryRecord(String userId, String verb);

    List<MasteryRecord> loadMasteryRecords(String userId);

    // False when a record for the same user and verb already exists
    boolean insertMasteryRecord(MasteryRecord masteryRecord);

    // False when the stored version no longer matches expectedVersion
    boolean updateMasteryRecord(MasteryRecord masteryRecord, long expectedVersion);

    int resetMasteryRecords(String userId, Collection<String> verbs, Instant resetInstant);

    int deleteMasteryRecordsForUser(String userId);
}
