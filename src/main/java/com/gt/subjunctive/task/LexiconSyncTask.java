package com.gt.subjunctive.task;

import com.gt.subjunctive.lexicon.VerbDao;
import com.gt.subjunctive.lexicon.VerbLexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

// Copies the lexicon into the verb table that exercises, attempts and mastery records reference
@Component
public class LexiconSyncTask {

    private static final Logger log = LoggerFactory.getLogger(LexiconSyncTask.class);

    private final VerbLexicon lexicon;
    private final VerbDao verbDao;

    @Autowired
    public LexiconSyncTask(VerbLexicon lexicon, VerbDao verbDao) {
        this.lexicon = lexicon;
        this.verbDao = verbDao;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void syncVerbs() {
        verbDao.saveVerbsBatch(lexicon.getVerbs());

        log.info("Synchronized {} lexicon verbs to the database", lexicon.size());
    }
}
