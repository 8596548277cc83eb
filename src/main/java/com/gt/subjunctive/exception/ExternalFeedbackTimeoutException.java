package com.gt.subjunctive.exception;

// Thrown when the feedback elaboration service does not answer within its time budget
public class ExternalFeedbackTimeoutException extends RuntimeException {

    public ExternalFeedbackTimeoutException(String errMsg)  {
        super(errMsg);
    }

    public ExternalFeedbackTimeoutException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
