package com.gt.tsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the topic store cannot be read, written or locked. The stored state is left as it was.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class PersistenceException extends RuntimeException {

    public PersistenceException(String errMsg)  {
        super(errMsg);
    }

    public PersistenceException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
