package com.gt.subjunctive.exercise.impl;

import com.gt.subjunctive.exercise.ExerciseDao;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class ExerciseDaoPG implements ExerciseDao {

    private static final Logger log = LoggerFactory.getLogger(ExerciseDaoPG.class);

    private static final String SAVE_EXERCISE_SQL =
            "INSERT INTO exercise " +
                    "(id, user_id, verb, tense, person, trigger_phrase, trigger_category, context, prompt, correct_answer, alternates, difficulty, hints, create_instant) " +
                    "VALUES (:id, :userId, :verb, :tense, :person, :triggerPhrase, :triggerCategory, :context, :prompt, :correctAnswer, :alternates, :difficulty, :hints, :createInstant)";

    private static final String LOAD_EXERCISE_SQL =
            "SELECT id, user_id, verb, tense, person, trigger_phrase, trigger_category, context, prompt, correct_answer, alternates, difficulty, hints, create_instant " +
            "FROM exercise " +
            "WHERE id = :id";

    private static final String LOAD_RECENT_EXERCISE_KEYS_SQL =
            "SELECT verb, tense, person " +
            "FROM exercise " +
            "WHERE user_id = :userId AND person IS NOT NULL " +
            "ORDER BY create_instant DESC LIMIT :limit";

    private static final String LOAD_LATEST_DIFFICULTY_SQL =
            "SELECT difficulty " +
            "FROM exercise " +
            "WHERE user_id = :userId " +
            "ORDER BY create_instant DESC LIMIT 1";

    private static final String DELETE_EXERCISES_FOR_USER_SQL =
            "DELETE FROM exercise WHERE user_id = :userId";

    private static final String PURGE_UNATTEMPTED_EXERCISES_SQL =
            "DELETE FROM exercise e " +
            "WHERE e.create_instant < :cutoff AND NOT EXISTS (SELECT 1 FROM attempt a WHERE a.exercise_id = e.id)";

    private final NamedParameterJdbcTemplate template;

    public ExerciseDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void saveExercise(Exercise exercise) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", exercise.id());
        params.addValue("userId", exercise.userId());
        params.addValue("verb", exercise.verb());
        params.addValue("tense", exercise.tense().getCode());
        params.addValue("person", exercise.person() == null ? null : exercise.person().getCode());
        params.addValue("triggerPhrase", exercise.triggerPhrase());
        params.addValue("triggerCategory", exercise.triggerCategory());
        params.addValue("context", exercise.context());
        params.addValue("prompt", exercise.prompt());
        params.addValue("correctAnswer", exercise.correctAnswer());
        params.addValue("alternates", exercise.alternates().toArray(new String[0]));
        params.addValue("difficulty", exercise.difficulty().getCode());
        params.addValue("hints", exercise.hints().toArray(new String[0]));
        params.addValue("createInstant", Timestamp.from(exercise.createdInstant()));

        template.update(SAVE_EXERCISE_SQL, params);
    }

    @Override
    public Optional<Exercise> loadExercise(String exerciseId) {
        List<Exercise> exercises = template.query(LOAD_EXERCISE_SQL, Map.of("id", exerciseId), ExerciseDaoPG::getExerciseFromResultSet);

        return exercises.stream().findFirst();
    }

    @Override
    public Set<ExerciseKey> loadRecentExerciseKeys(String userId, int limit) {
        List<ExerciseKey> keys = template.query(LOAD_RECENT_EXERCISE_KEYS_SQL, Map.of("userId", userId, "limit", limit),
                (rs, rowNum) -> new ExerciseKey(
                        rs.getString("verb"),
                        Tense.fromCode(rs.getString("tense")),
                        Person.fromCode(rs.getString("person"))));

        return new HashSet<>(keys);
    }

    @Override
    public Optional<Difficulty> loadLatestDifficulty(String userId) {
        List<Difficulty> difficulties = template.query(LOAD_LATEST_DIFFICULTY_SQL, Map.of("userId", userId),
                (rs, rowNum) -> Difficulty.fromCode(rs.getString("difficulty")));

        return difficulties.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public int deleteExercisesForUser(String userId) {
        return template.update(DELETE_EXERCISES_FOR_USER_SQL, Map.of("userId", userId));
    }

    @Override
    public int purgeUnattemptedExercises(Instant cutoff) {
        return template.update(PURGE_UNATTEMPTED_EXERCISES_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }

    private static Exercise getExerciseFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        String personCode = rs.getString("person");
        Person person = personCode == null ? null : Person.fromCode(personCode);
        if (personCode != null && person == null) {
            log.warn("Exercise {} has unrecognized person '{}'", rs.getString("id"), personCode);
        }

        return new Exercise(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("verb"),
                Tense.fromCode(rs.getString("tense")),
                person,
                rs.getString("trigger_phrase"),
                rs.getString("trigger_category"),
                rs.getString("context"),
                rs.getString("prompt"),
                rs.getString("correct_answer"),
                getStringList(rs.getArray("alternates")),
                Difficulty.fromCode(rs.getString("difficulty")),
                getStringList(rs.getArray("hints")),
                rs.getTimestamp("create_instant").toInstant());
    }

    private static List<String> getStringList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }

        return Arrays.asList((String[]) array.getArray());
    }
}
