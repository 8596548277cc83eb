package com.gt.subjunctive.attempt.impl;

import com.gt.subjunctive.attempt.AttemptDao;
import com.gt.subjunctive.model.Attempt;
import com.gt.subjunctive.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

public class AttemptDaoPG implements AttemptDao {

    private static final Logger log = LoggerFactory.getLogger(AttemptDaoPG.class);

    private static final String SAVE_ATTEMPT_SQL =
            "INSERT INTO attempt " +
                    "(id, user_id, exercise_id, verb, submitted_text, attempt_instant, correct, error_kind, elapsed_time_ms) " +
                    "VALUES (:id, :userId, :exerciseId, :verb, :submittedText, :attemptInstant, :correct, :errorKind, :elapsedTimeMs)";

    private static final String LOAD_RECENT_ATTEMPTS_SQL =
            "SELECT id, user_id, exercise_id, verb, submitted_text, attempt_instant, correct, error_kind, elapsed_time_ms " +
            "FROM attempt " +
            "WHERE user_id = :userId " +
            "ORDER BY attempt_instant DESC LIMIT :limit";

    private static final String DELETE_ATTEMPTS_FOR_USER_SQL =
            "DELETE FROM attempt WHERE user_id = :userId";

    private final NamedParameterJdbcTemplate template;

    public AttemptDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void saveAttempt(Attempt attempt) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", attempt.id());
        params.addValue("userId", attempt.userId());
        params.addValue("exerciseId", attempt.exerciseId());
        params.addValue("verb", attempt.verb());
        params.addValue("submittedText", attempt.submittedText());
        params.addValue("attemptInstant", Timestamp.from(attempt.attemptInstant()));
        params.addValue("correct", attempt.correct());
        params.addValue("errorKind", attempt.errorKind().getCode());
        params.addValue("elapsedTimeMs", attempt.elapsedTimeMs());

        template.update(SAVE_ATTEMPT_SQL, params);
    }

    @Override
    public List<Attempt> loadRecentAttempts(String userId, int limit) {
        return template.query(LOAD_RECENT_ATTEMPTS_SQL, Map.of("userId", userId, "limit", limit), AttemptDaoPG::getAttemptFromResultSet);
    }

    @Override
    public int deleteAttemptsForUser(String userId) {
        int rowsDeleted = template.update(DELETE_ATTEMPTS_FOR_USER_SQL, Map.of("userId", userId));
        log.info("Deleted {} attempts for user {}", rowsDeleted, userId);

        return rowsDeleted;
    }

    private static Attempt getAttemptFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Attempt(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("exercise_id"),
                rs.getString("verb"),
                rs.getString("submitted_text"),
                rs.getTimestamp("attempt_instant").toInstant(),
                rs.getBoolean("correct"),
                ErrorKind.fromCode(rs.getString("error_kind")),
                rs.getObject("elapsed_time_ms", Long.class));
    }
}
