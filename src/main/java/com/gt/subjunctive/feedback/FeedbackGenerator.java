package com.gt.subjunctive.feedback;

import com.gt.subjunctive.exception.ExternalFeedbackTimeoutException;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Builds the explanation shown after an answer. The deterministic part is always produced; the
 * elaboration is requested only for wrong answers, when an elaborator is configured, and is dropped
 * when it fails or takes longer than the timeout.
 */
@Component
public class FeedbackGenerator {

    private static final Logger log = LoggerFactory.getLogger(FeedbackGenerator.class);

    private final FeedbackElaborator feedbackElaborator;
    private final ExecutorService feedbackExecutor;
    private final long elaborationTimeoutMs;

    @Autowired
    public FeedbackGenerator(FeedbackElaborator feedbackElaborator,
                             @Qualifier("feedbackExecutor") ExecutorService feedbackExecutor,
                             @Value("${subjunctive.feedback.elaborator.timeoutMs:2000}") long elaborationTimeoutMs) {
        this.feedbackElaborator = feedbackElaborator;
        this.feedbackExecutor = feedbackExecutor;
        this.elaborationTimeoutMs = elaborationTimeoutMs;
    }

    public Feedback explain(ValidationVerdict verdict, Exercise exercise, ConjugationResult result) {
        String correctAnswer = result == null ? exercise.correctAnswer() : result.canonical();
        String ruleExplanation = result == null ? null : result.ruleExplanation();

        if (verdict.correct()) {
            String explanation = "'" + verdict.matchedForm() + "' is the " + exercise.tense().getDisplayName()
                    + " after '" + exercise.triggerPhrase() + "'.";
            if (verdict.accentWarning()) {
                explanation += " Watch the written accent: the form is spelled '" + correctAnswer + "'.";
            }

            return new Feedback(verdict.accentWarning() ? "Correct, but check the accent." : "Correct!",
                    explanation, ruleExplanation, correctAnswer, List.of(), null);
        }

        return new Feedback(headline(verdict),
                explanation(verdict, exercise, correctAnswer),
                ruleExplanation,
                correctAnswer,
                suggestions(verdict.errorKind(), exercise),
                null);
    }

    public Feedback explainWithElaboration(ValidationVerdict verdict, Exercise exercise, ConjugationResult result, String answer) {
        Feedback feedback = explain(verdict, exercise, result);
        if (verdict.correct() || !feedbackElaborator.isEnabled()) {
            return feedback;
        }

        try {
            return feedback.withElaboration(requestElaboration(buildElaborationPrompt(feedback, exercise, answer)));
        } catch (ExternalFeedbackTimeoutException ex) {
            log.warn("Using deterministic feedback for exercise {}: {}", exercise.id(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Feedback elaboration failed for exercise {}. Using deterministic feedback.", exercise.id(), ex);
        }

        return feedback;
    }

    private String requestElaboration(String prompt) {
        Future<String> future = feedbackExecutor.submit(() -> feedbackElaborator.elaborate(prompt));

        try {
            return future.get(elaborationTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ExternalFeedbackTimeoutException("No elaboration within " + elaborationTimeoutMs + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalFeedbackTimeoutException("Interrupted while waiting for elaboration", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Elaboration request failed", ex.getCause());
        }
    }

    private static String headline(ValidationVerdict verdict) {
        switch (verdict.errorKind()) {
            case AccentOnly:
                return "Almost! Only the accent is missing.";
            case WrongPerson:
                return "Right verb form, wrong person.";
            case WrongMoodOrTense:
                return verdict.indicativeForm() ? "That is the indicative, not the subjunctive." : "Wrong tense.";
            case WrongEnding:
                return "Check the ending.";
            case WrongStem:
                return "Check the stem.";
            default:
                return verdict.nearMiss() ? "Very close, but not quite." : "Not quite.";
        }
    }

    private static String explanation(ValidationVerdict verdict, Exercise exercise, String correctAnswer) {
        String person = exercise.person() == null ? "the subject" : exercise.person().getPronounLabel();

        switch (verdict.errorKind()) {
            case AccentOnly:
                return "Your answer matches '" + correctAnswer + "' except for the written accent.";
            case WrongPerson:
                return "Your answer is a correct " + exercise.tense().getDisplayName() + " form, but for a different person. "
                        + "This sentence needs the form for " + person + ": '" + correctAnswer + "'.";
            case WrongMoodOrTense:
                if (verdict.indicativeForm()) {
                    return "You used the indicative, but '" + exercise.triggerPhrase() + "' requires the subjunctive. "
                            + "The correct form is '" + correctAnswer + "'.";
                }
                return "Your answer is a different subjunctive tense. This exercise needs the "
                        + exercise.tense().getDisplayName() + ": '" + correctAnswer + "'.";
            case WrongEnding:
                String ending = "The stem is right but the ending is not. The correct form is '" + correctAnswer + "'.";
                return verdict.indicativeForm()
                        ? ending + " You used the indicative ending; '" + exercise.triggerPhrase() + "' requires the subjunctive."
                        : ending;
            case WrongStem:
                return "The ending is right but the stem is not. The correct form is '" + correctAnswer + "'.";
            default:
                return (verdict.nearMiss() ? "There is a small spelling error. " : "") + "The correct form is '" + correctAnswer + "'.";
        }
    }

    private static List<String> suggestions(ErrorKind errorKind, Exercise exercise) {
        List<String> suggestions = new ArrayList<>();

        switch (errorKind) {
            case WrongMoodOrTense:
                suggestions.add("Review the WEIRDO triggers that require the subjunctive.");
                suggestions.add("Let the tense of the main clause guide the subjunctive tense.");
                break;
            case WrongPerson:
                suggestions.add("Pay attention to the subject pronoun after 'que'.");
                suggestions.add("Review all six persons of '" + exercise.verb() + "'.");
                break;
            case WrongEnding:
                suggestions.add("-ar verbs take e-endings and -er/-ir verbs take a-endings in the present subjunctive.");
                break;
            case WrongStem:
                suggestions.add("Start from the yo form of the present indicative and note any stem change.");
                break;
            case AccentOnly:
                suggestions.add("Written accents distinguish forms; practice typing them.");
                break;
            default:
                break;
        }

        return suggestions;
    }

    private static String buildElaborationPrompt(Feedback feedback, Exercise exercise, String answer) {
        return "A Spanish learner completed the sentence \"" + exercise.prompt() + "\" with \"" + answer + "\". "
                + "The correct answer is \"" + feedback.correctAnswer() + "\". "
                + feedback.explanation() + " "
                + (feedback.ruleExplanation() == null ? "" : "Rule: " + feedback.ruleExplanation() + ". ")
                + "In two sentences, explain the mistake to the learner in English.";
    }
}
