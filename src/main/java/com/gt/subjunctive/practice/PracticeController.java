package com.gt.subjunctive.practice;

import com.gt.subjunctive.delete.AccountErasureService;
import com.gt.subjunctive.exception.InvalidRequestException;
import com.gt.subjunctive.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/rest/practice")
public class PracticeController {

    private static final Logger log = LoggerFactory.getLogger(PracticeController.class);

    private final PracticeService practiceService;
    private final AccountErasureService accountErasureService;

    public PracticeController(PracticeService practiceService, AccountErasureService accountErasureService) {
        this.practiceService = practiceService;
        this.accountErasureService = accountErasureService;
    }

    @GetMapping(value = "/exercise", produces = "application/json")
    public ExercisePayload getExercise(@RequestParam(value = "userId") String userId,
                                       @RequestParam(value = "tense", required = false) List<String> tenseCodes,
                                       @RequestParam(value = "verb", required = false) List<String> verbs,
                                       @RequestParam(value = "difficulty", required = false) String difficultyCode,
                                       @RequestParam(value = "adaptive", defaultValue = "true") boolean adaptive) {
        Exercise exercise = practiceService.getExercise(userId,
                verbs == null ? Set.of() : new HashSet<>(verbs),
                parseTenses(tenseCodes),
                parseDifficulty(difficultyCode),
                adaptive);

        return ExercisePayload.fromExercise(exercise);
    }

    @PostMapping(value = "/answer", consumes = "application/json", produces = "application/json")
    public AnswerResult submitAnswer(@RequestBody AnswerRequest answerRequest) {
        if (answerRequest.exerciseId() == null || answerRequest.userId() == null) {
            throw new InvalidRequestException("exerciseId and userId are required");
        }

        return practiceService.submitAnswer(answerRequest.exerciseId(),
                answerRequest.userId(),
                answerRequest.answer() == null ? "" : answerRequest.answer(),
                answerRequest.elapsedTimeMs());
    }

    @GetMapping(value = "/dueReviewQueue", produces = "application/json")
    public List<String> getDueReviewQueue(@RequestParam(value = "userId") String userId,
                                          @RequestParam(value = "limit", defaultValue = "0") int limit) {
        return practiceService.getDueReviewQueue(userId, limit);
    }

    @GetMapping(value = "/mastery", produces = "application/json")
    public List<MasterySummary> getMasterySummary(@RequestParam(value = "userId") String userId) {
        return practiceService.getMasterySummary(userId);
    }

    @PostMapping(value = "/resetMastery", consumes = "application/json")
    public int resetMastery(@RequestBody ResetMasteryRequest resetMasteryRequest) {
        log.info("Resetting mastery for user {}", resetMasteryRequest.userId());

        return practiceService.resetMastery(resetMasteryRequest.userId(),
                resetMasteryRequest.verbs() == null ? List.of() : resetMasteryRequest.verbs());
    }

    @DeleteMapping(value = "/user")
    public void eraseUser(@RequestParam(value = "userId") String userId) {
        accountErasureService.eraseUser(userId);
    }

    private static Set<Tense> parseTenses(List<String> tenseCodes) {
        if (tenseCodes == null || tenseCodes.isEmpty()) {
            return Set.of();
        }

        Set<Tense> tenses = EnumSet.noneOf(Tense.class);
        for (String tenseCode : tenseCodes) {
            Tense tense = Tense.fromCode(tenseCode);
            if (tense == null) {
                throw new InvalidRequestException("Unknown tense: " + tenseCode);
            }
            tenses.add(tense);
        }

        return tenses;
    }

    private static Difficulty parseDifficulty(String difficultyCode) {
        if (difficultyCode == null || difficultyCode.isBlank()) {
            return null;
        }

        Difficulty difficulty = Difficulty.fromCode(difficultyCode);
        if (difficulty == null) {
            throw new InvalidRequestException("Unknown difficulty: " + difficultyCode);
        }

        return difficulty;
    }

    private record AnswerRequest(String exerciseId, String userId, String answer, Long elapsedTimeMs) { }
    private record ResetMasteryRequest(String userId, List<String> verbs) { }
}
