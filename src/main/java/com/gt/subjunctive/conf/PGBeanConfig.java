package com.gt.subjunctive.conf;

import com.gt.subjunctive.attempt.AttemptDao;
import com.gt.subjunctive.attempt.impl.AttemptDaoPG;
import com.gt.subjunctive.exercise.ExerciseDao;
import com.gt.subjunctive.exercise.impl.ExerciseDaoPG;
import com.gt.subjunctive.lexicon.VerbDao;
import com.gt.subjunctive.lexicon.impl.VerbDaoPG;
import com.gt.subjunctive.mastery.MasteryDao;
import com.gt.subjunctive.mastery.impl.MasteryDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${subjunctive.datasource.postgres.url}") String url,
                                    @Value("${subjunctive.datasource.postgres.username}") String username,
                                    @Value("${subjunctive.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public VerbDao getVerbDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new VerbDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ExerciseDao getExerciseDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ExerciseDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public AttemptDao getAttemptDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new AttemptDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public MasteryDao getMasteryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new MasteryDaoPG(namedParameterJdbcTemplate);
    }
}
