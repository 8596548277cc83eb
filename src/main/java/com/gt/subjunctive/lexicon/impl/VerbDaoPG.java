package com.gt.subjunctive.lexicon.impl;

import com.gt.subjunctive.lexicon.VerbDao;
import com.gt.subjunctive.model.Verb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class VerbDaoPG implements VerbDao {

    private static final Logger log = LoggerFactory.getLogger(VerbDaoPG.class);

    private static final String SAVE_VERB_SQL =
            "INSERT INTO verb (infinitive, translation, regularity, stem_change, common, update_instant) " +
            "VALUES (:infinitive, :translation, :regularity, :stemChange, :common, :updateInstant) " +
            "ON CONFLICT (infinitive) DO UPDATE " +
            "SET translation = :translation, regularity = :regularity, stem_change = :stemChange, common = :common, update_instant = :updateInstant";

    private static final String LOAD_VERB_INFINITIVES_SQL =
            "SELECT infinitive FROM verb ORDER BY infinitive";

    private final NamedParameterJdbcTemplate template;

    public VerbDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void saveVerbsBatch(Collection<Verb> verbs) {
        Timestamp updateInstant = Timestamp.from(Instant.now());
        List<SqlParameterSource> params = new ArrayList<>();

        for (Verb verb : verbs) {
            params.add(new MapSqlParameterSource(Map.of(
                    "infinitive", verb.infinitive(),
                    "translation", verb.translation(),
                    "regularity", verb.regularity().getCode(),
                    "stemChange", verb.stemChange().getCode(),
                    "common", verb.common(),
                    "updateInstant", updateInstant)));
        }

        int[] rowCounts = template.batchUpdate(SAVE_VERB_SQL, params.toArray(new SqlParameterSource[0]));
        log.debug("Saved {} verb rows", rowCounts.length);
    }

    @Override
    public List<String> loadVerbInfinitives() {
        return template.queryForList(LOAD_VERB_INFINITIVES_SQL, Map.of(), String.class);
    }
}
