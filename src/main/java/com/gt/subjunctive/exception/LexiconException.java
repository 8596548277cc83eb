package com.gt.subjunctive.exception;

// Thrown when the verb reference data cannot be loaded or fails validation
public class LexiconException extends RuntimeException {

    public LexiconException(String errMsg)  {
        super(errMsg);
    }

    public LexiconException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
