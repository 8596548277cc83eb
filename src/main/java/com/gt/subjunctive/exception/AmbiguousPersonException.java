package com.gt.subjunctive.exception;

// Thrown when a legacy prompt does not name exactly one grammatical person
public class AmbiguousPersonException extends RuntimeException {

    public AmbiguousPersonException(String errMsg)  {
        super(errMsg);
    }

    public AmbiguousPersonException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
