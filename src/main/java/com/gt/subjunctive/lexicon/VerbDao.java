package com.gt.subjunctive.lexicon;

import com.gt.subjunctive.model.Verb;

import java.util.Collection;
import java.util.List;

public interface VerbDao {

    void saveVerbsBatch(Collection<Verb> verbs);

    List<String> loadVerbInfinitives();
}
