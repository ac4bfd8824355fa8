package com.gt.tsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a caller supplies a topic name or argument that can never be stored
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidTopicException extends IllegalArgumentException {

    public InvalidTopicException(String msg) {
        super(msg);
    }
}
