package com.gt.subjunctive.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when no (verb, tense, person) combination satisfies the requested filters
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class NoEligibleExerciseException extends RuntimeException {

    public NoEligibleExerciseException(String errMsg)  {
        super(errMsg);
    }

    public NoEligibleExerciseException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
