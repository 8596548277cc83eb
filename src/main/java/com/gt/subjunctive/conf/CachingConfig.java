package com.gt.subjunctive.conf;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// Conjugation output only depends on the lexicon, which is fixed for the life of the process, so entries never expire
@Configuration
@EnableCaching
public class CachingConfig {

    public static final String CONJUGATION_TABLES = "conjugation_tables";
    public static final String VERB_INFO = "verb_info";

    @Bean
    public CacheManager getConjugationCacheManager() {
        return new ConcurrentMapCacheManager(CONJUGATION_TABLES, VERB_INFO);
    }
}
