package com.gt.subjunctive.conjugation;

import com.gt.subjunctive.exception.InvalidRequestException;
import com.gt.subjunctive.model.ConjugationResult;
import com.gt.subjunctive.model.Tense;
import com.gt.subjunctive.model.VerbInfo;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/conjugation")
public class ConjugationController {

    private final ConjugationService conjugationService;

    public ConjugationController(ConjugationService conjugationService) {
        this.conjugationService = conjugationService;
    }

    @GetMapping(value = "/table", produces = "application/json")
    public List<ConjugationResult> getConjugationTable(@RequestParam(value = "verb") String verb,
                                                       @RequestParam(value = "tense") String tenseCode) {
        Tense tense = Tense.fromCode(tenseCode);
        if (tense == null) {
            throw new InvalidRequestException("Unknown tense: " + tenseCode);
        }

        return conjugationService.getConjugationTable(verb, tense);
    }

    @GetMapping(value = "/verb", produces = "application/json")
    public VerbInfo getVerbInfo(@RequestParam(value = "verb") String verb) {
        return conjugationService.getVerbInfo(verb);
    }

    @GetMapping(value = "/verbs", produces = "application/json")
    public List<VerbInfo> getAllVerbs() {
        return conjugationService.getAllVerbInfo();
    }
}
