package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.conf.CachingConfig;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.ConjugationResult;
import com.gt.subjunctive.model.Tense;
import com.gt.subjunctive.model.Verb;
import com.gt.subjunctive.model.VerbInfo;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ConjugationService {

    private final VerbLexicon lexicon;
    private final ConjugationEngine conjugationEngine;

    @Autowired
    public ConjugationService(VerbLexicon lexicon, ConjugationEngine conjugationEngine) {
        this.lexicon = lexicon;
        this.conjugationEngine = conjugationEngine;
    }

    @Cacheable(CachingConfig.CONJUGATION_TABLES)
    public List<ConjugationResult> getConjugationTable(String infinitive, Tense tense) {
        return conjugationEngine.conjugateAll(infinitive, tense);
    }

    @Cacheable(CachingConfig.VERB_INFO)
    public VerbInfo getVerbInfo(String infinitive) {
        return conjugationEngine.describe(infinitive);
    }

    public List<VerbInfo> getAllVerbInfo() {
        return lexicon.getVerbs().stream()
                .map(Verb::infinitive)
                .map(conjugationEngine::describe)
                .collect(Collectors.toList());
    }
}
