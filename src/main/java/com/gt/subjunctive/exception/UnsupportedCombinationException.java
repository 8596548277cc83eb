package com.gt.subjunctive.exception;

// Thrown when the engine has no rule for a (verb, tense, person) request. Indicates a caller or configuration bug
public class UnsupportedCombinationException extends RuntimeException {

    public UnsupportedCombinationException(String errMsg)  {
        super(errMsg);
    }

    public UnsupportedCombinationException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
