package com.gt.subjunctive.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a verb is not in the lexicon. The engine never guesses a form for it
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class UnknownVerbException extends RuntimeException {

    private final String infinitive;

    public UnknownVerbException(String infinitive) {
        super("Unknown verb: " + infinitive);
        this.infinitive = infinitive;
    }

    public String getInfinitive() {
        return infinitive;
    }
}
