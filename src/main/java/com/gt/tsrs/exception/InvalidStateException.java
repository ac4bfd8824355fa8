package com.gt.tsrs.exception;

// Thrown when a persisted topic record is missing data and cannot be coerced into a valid topic
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String errMsg)  {
        super(errMsg);
    }

    public InvalidStateException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
