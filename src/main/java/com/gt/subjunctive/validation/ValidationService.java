package com.gt.subjunctive.validation;

import com.gt.subjunctive.conjugation.ConjugationEngine;
import com.gt.subjunctive.exception.AmbiguousPersonException;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ValidationService {

    private static final Logger log = LoggerFactory.getLogger(ValidationService.class);

    private final ConjugationEngine conjugationEngine;
    private final AnswerValidator answerValidator;
    private final PersonExtractor personExtractor;
    private final boolean accentInsensitive;

    @Autowired
    public ValidationService(ConjugationEngine conjugationEngine,
                             AnswerValidator answerValidator,
                             PersonExtractor personExtractor,
                             @Value("${subjunctive.validation.accentInsensitive:true}") boolean accentInsensitive) {
        this.conjugationEngine = conjugationEngine;
        this.answerValidator = answerValidator;
        this.personExtractor = personExtractor;
        this.accentInsensitive = accentInsensitive;
    }

    public GradedAnswer gradeAnswer(Exercise exercise, String answer) {
        Person person = exercise.person();

        if (exercise.isLegacy()) {
            try {
                person = personExtractor.extractPerson(exercise.prompt());
                log.info("Recovered person {} from prompt of legacy exercise {}", person.getCode(), exercise.id());
            } catch (AmbiguousPersonException ex) {
                log.warn("Grading legacy exercise {} against stored answers: {}", exercise.id(), ex.getMessage());

                return new GradedAnswer(
                        answerValidator.validateAgainstStored(answer, exercise.correctAnswer(), exercise.alternates(), accentInsensitive),
                        null);
            }
        }

        ConjugationResult result = conjugationEngine.conjugate(exercise.verb(), exercise.tense(), person);
        if (!result.canonical().equals(exercise.correctAnswer())) {
            log.warn("Stored answer '{}' for exercise {} differs from the engine's '{}'. Grading with the engine form",
                    exercise.correctAnswer(), exercise.id(), result.canonical());
        }

        return new GradedAnswer(answerValidator.validate(answer, result, accentInsensitive), result);
    }

    public boolean isAccentInsensitive() {
        return accentInsensitive;
    }
}
