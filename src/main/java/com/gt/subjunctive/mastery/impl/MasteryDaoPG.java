package com.gt.subjunctive.mastery.impl;

import com.gt.subjunctive.mastery.MasteryDao;
import com.gt.subjunctive.model.MasteryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class MasteryDaoPG implements MasteryDao {

    private static final Logger log = LoggerFactory.getLogger(MasteryDaoPG.class);

    private static final String MASTERY_COLUMNS =
            "user_id, verb, consecutive_correct, total_attempts, total_correct, current_interval_sec, next_review_instant, last_correct, last_attempt_instant, version ";

    private static final String LOAD_MASTERY_RECORD_SQL =
            "SELECT " + MASTERY_COLUMNS +
            "FROM mastery_record " +
            "WHERE user_id = :userId AND verb = :verb";

    private static final String LOAD_MASTERY_RECORDS_SQL =
            "SELECT " + MASTERY_COLUMNS +
            "FROM mastery_record " +
            "WHERE user_id = :userId " +
            "ORDER BY verb";

    private static final String INSERT_MASTERY_RECORD_SQL =
            "INSERT INTO mastery_record (" + MASTERY_COLUMNS + ") " +
            "VALUES (:userId, :verb, :consecutiveCorrect, :totalAttempts, :totalCorrect, :currentIntervalSec, :nextReviewInstant, :lastCorrect, :lastAttemptInstant, :version) " +
            "ON CONFLICT (user_id, verb) DO NOTHING";

    private static final String UPDATE_MASTERY_RECORD_SQL =
            "UPDATE mastery_record " +
            "SET consecutive_correct = :consecutiveCorrect, total_attempts = :totalAttempts, total_correct = :totalCorrect, " +
                    "current_interval_sec = :currentIntervalSec, next_review_instant = :nextReviewInstant, last_correct = :lastCorrect, " +
                    "last_attempt_instant = :lastAttemptInstant, version = :version " +
            "WHERE user_id = :userId AND verb = :verb AND version = :expectedVersion";

    private static final String RESET_MASTERY_RECORDS_SQL =
            "UPDATE mastery_record " +
            "SET consecutive_correct = 0, current_interval_sec = 0, next_review_instant = :resetInstant, last_correct = false, version = version + 1 " +
            "WHERE user_id = :userId AND verb IN (:verbs)";

    private static final String DELETE_MASTERY_RECORDS_FOR_USER_SQL =
            "DELETE FROM mastery_record WHERE user_id = :userId";

    private final NamedParameterJdbcTemplate template;

    public MasteryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<MasteryRecord> loadMasteryRecord(String userId, String verb) {
        return template.query(LOAD_MASTERY_RECORD_SQL, Map.of("userId", userId, "verb", verb), MasteryDaoPG::getMasteryRecordFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public List<MasteryRecord> loadMasteryRecords(String userId) {
        return template.query(LOAD_MASTERY_RECORDS_SQL, Map.of("userId", userId), MasteryDaoPG::getMasteryRecordFromResultSet);
    }

    @Override
    public boolean insertMasteryRecord(MasteryRecord masteryRecord) {
        return template.update(INSERT_MASTERY_RECORD_SQL, toParams(masteryRecord)) > 0;
    }

    @Override
    public boolean updateMasteryRecord(MasteryRecord masteryRecord, long expectedVersion) {
        MapSqlParameterSource params = toParams(masteryRecord);
        params.addValue("expectedVersion", expectedVersion);

        return template.update(UPDATE_MASTERY_RECORD_SQL, params) > 0;
    }

    @Override
    public int resetMasteryRecords(String userId, Collection<String> verbs, Instant resetInstant) {
        if (verbs.isEmpty()) {
            return 0;  // an empty IN list is a syntax error
        }

        return template.update(RESET_MASTERY_RECORDS_SQL, Map.of(
                "userId", userId,
                "verbs", verbs,
                "resetInstant", Timestamp.from(resetInstant)));
    }

    @Override
    public int deleteMasteryRecordsForUser(String userId) {
        int rowsDeleted = template.update(DELETE_MASTERY_RECORDS_FOR_USER_SQL, Map.of("userId", userId));
        log.info("Deleted {} mastery records for user {}", rowsDeleted, userId);

        return rowsDeleted;
    }

    private static MapSqlParameterSource toParams(MasteryRecord masteryRecord) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("userId", masteryRecord.userId());
        params.addValue("verb", masteryRecord.verb());
        params.addValue("consecutiveCorrect", masteryRecord.consecutiveCorrect());
        params.addValue("totalAttempts", masteryRecord.totalAttempts());
        params.addValue("totalCorrect", masteryRecord.totalCorrect());
        params.addValue("currentIntervalSec", masteryRecord.currentInterval().toSeconds());
        params.addValue("nextReviewInstant", Timestamp.from(masteryRecord.nextReviewInstant()));
        params.addValue("lastCorrect", masteryRecord.lastCorrect());
        params.addValue("lastAttemptInstant", masteryRecord.lastAttemptInstant() == null ? null : Timestamp.from(masteryRecord.lastAttemptInstant()));
        params.addValue("version", masteryRecord.version());

        return params;
    }

    private static MasteryRecord getMasteryRecordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Timestamp lastAttemptInstant = rs.getTimestamp("last_attempt_instant");

        return new MasteryRecord(
                rs.getString("user_id"),
                rs.getString("verb"),
                rs.getInt("consecutive_correct"),
                rs.getInt("total_attempts"),
                rs.getInt("total_correct"),
                Duration.ofSeconds(rs.getLong("current_interval_sec")),
                rs.getTimestamp("next_review_instant").toInstant(),
                rs.getBoolean("last_correct"),
                lastAttemptInstant == null ? null : lastAttemptInstant.toInstant(),
                rs.getLong("version"));
    }
}
