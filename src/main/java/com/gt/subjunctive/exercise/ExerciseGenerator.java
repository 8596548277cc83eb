package com.gt.subjunctive.exercise;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.exception.NoEligibleExerciseException;
import com.gt.subjunctive.lexicon.VerbLexicon;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Picks a (verb, tense, person) the user may practice and renders it as a prompt.
 * <p>
 * Candidates are limited by difficulty tier and the request filters, and every candidate must be
 * supported by the conjugation engine. Recently seen combinations are skipped unless nothing else is
 * left. In adaptive mode verbs due for review are sampled with a higher weight.
 */
@Component
public class ExerciseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExerciseGenerator.class);

    private static final Map<Difficulty, Set<Tense>> TENSES_BY_DIFFICULTY = Map.of(
            Difficulty.Beginner, EnumSet.of(Tense.PresentSubjunctive),
            Difficulty.Intermediate, EnumSet.of(Tense.PresentSubjunctive, Tense.ImperfectSubjunctive, Tense.PresentPerfectSubjunctive),
            Difficulty.Advanced, EnumSet.allOf(Tense.class));

    private final VerbLexicon lexicon;
    private final ConjugationEngine conjugationEngine;
    private final HintBuilder hintBuilder;
    private final Random random;
    private final double dueWeight;

    @Autowired
    public ExerciseGenerator(VerbLexicon lexicon,
                             ConjugationEngine conjugationEngine,
                             HintBuilder hintBuilder,
                             Random random,
                             @Value("${subjunctive.exercise.dueWeight:3.0}") double dueWeight) {
        this.lexicon = lexicon;
        this.conjugationEngine = conjugationEngine;
        this.hintBuilder = hintBuilder;
        this.random = random;
        this.dueWeight = dueWeight;
    }

    public Exercise generate(ExerciseCriteria criteria, PracticeContext context) {
        Difficulty difficulty = criteria.difficulty() == null ? Difficulty.Advanced : criteria.difficulty();

        Map<Verb, List<ExerciseKey>> candidates = findCandidates(criteria, difficulty);
        if (candidates.isEmpty()) {
            String errMsg = "No exercise matches verbs " + criteria.verbs() + ", tenses " + criteria.tenses()
                    + " at difficulty " + difficulty.getCode();

            log.error(errMsg);
            throw new NoEligibleExerciseException(errMsg);
        }

        Map<Verb, List<ExerciseKey>> pool = excludeRecentlySeen(candidates, criteria.recentlySeen());
        if (pool.isEmpty()) {
            log.info("All {} candidate verbs were seen recently by user {}. Allowing repeats.", candidates.size(), context.userId());
            pool = candidates;
        }

        Verb verb = sampleVerb(pool, context);
        List<ExerciseKey> keys = pool.get(verb);
        ExerciseKey key = keys.get(random.nextInt(keys.size()));

        return buildExercise(context.userId(), verb, key.tense(), key.person(), difficulty);
    }

    public static Set<Tense> tensesFor(Difficulty difficulty) {
        return TENSES_BY_DIFFICULTY.get(difficulty);
    }

    Map<Verb, List<ExerciseKey>> findCandidates(ExerciseCriteria criteria, Difficulty difficulty) {
        Set<Tense> tenses = EnumSet.noneOf(Tense.class);
        tenses.addAll(tensesFor(difficulty));
        if (criteria.tenses() != null && !criteria.tenses().isEmpty()) {
            tenses.retainAll(criteria.tenses());
        }

        Map<Verb, List<ExerciseKey>> candidates = new LinkedHashMap<>();
        for (Verb verb : lexicon.getVerbs()) {
            if (criteria.verbs() != null && !criteria.verbs().isEmpty() && !criteria.verbs().contains(verb.infinitive())) {
                continue;
            }
            if (!difficulty.allows(verb.minimumDifficulty())) {
                continue;
            }

            List<ExerciseKey> keys = new ArrayList<>();
            for (Tense tense : tenses) {
                for (Person person : Person.values()) {
                    if (conjugationEngine.supports(verb.infinitive(), tense, person)) {
                        keys.add(new ExerciseKey(verb.infinitive(), tense, person));
                    }
                }
            }

            if (!keys.isEmpty()) {
                candidates.put(verb, keys);
            }
        }

        return candidates;
    }

    private static Map<Verb, List<ExerciseKey>> excludeRecentlySeen(Map<Verb, List<ExerciseKey>> candidates, Set<ExerciseKey> recentlySeen) {
        if (recentlySeen == null || recentlySeen.isEmpty()) {
            return candidates;
        }

        Map<Verb, List<ExerciseKey>> unseen = new LinkedHashMap<>();
        for (Map.Entry<Verb, List<ExerciseKey>> entry : candidates.entrySet()) {
            List<ExerciseKey> keys = entry.getValue().stream().filter(key -> !recentlySeen.contains(key)).collect(Collectors.toList());
            if (!keys.isEmpty()) {
                unseen.put(entry.getKey(), keys);
            }
        }

        return unseen;
    }

    private Verb sampleVerb(Map<Verb, List<ExerciseKey>> pool, PracticeContext context) {
        List<Verb> verbs = new ArrayList<>(pool.keySet());
        if (!context.adaptive() || context.dueVerbs() == null || context.dueVerbs().isEmpty()) {
            return verbs.get(random.nextInt(verbs.size()));
        }

        Set<String> dueVerbs = new HashSet<>(context.dueVerbs());
        double[] weights = new double[verbs.size()];
        double totalWeight = 0;
        for (int index = 0; index < verbs.size(); index++) {
            weights[index] = dueVerbs.contains(verbs.get(index).infinitive()) ? dueWeight : 1.0;
            totalWeight += weights[index];
        }

        double target = random.nextDouble() * totalWeight;
        for (int index = 0; index < verbs.size(); index++) {
            target -= weights[index];
            if (target < 0) {
                return verbs.get(index);
            }
        }

        return verbs.get(verbs.size() - 1);
    }

    private Exercise buildExercise(String userId, Verb verb, Tense tense, Person person, Difficulty difficulty) {
        ConjugationResult result = conjugationEngine.conjugate(verb, tense, person);

        TriggerCategory category = TriggerCategory.values()[random.nextInt(TriggerCategory.values().length)];
        String trigger = category.pickTrigger(tense.isPastContext(), random);
        String pronoun = person.getPronouns().get(random.nextInt(person.getPronouns().size()));
        String prompt = trigger + " " + pronoun + " ____ (" + verb.infinitive() + ").";

        return new Exercise(UUID.randomUUID().toString(),
                userId,
                verb.infinitive(),
                tense,
                person,
                trigger,
                category.getCode(),
                category.pickContext(random),
                prompt,
                result.canonical(),
                result.alternates(),
                difficulty,
                hintBuilder.buildHints(verb, result),
                Instant.now());
    }
}
