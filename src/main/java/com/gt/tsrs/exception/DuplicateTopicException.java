package com.gt.tsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.CONFLICT)
public class DuplicateTopicException extends RuntimeException {

    private final String topicName;

    public DuplicateTopicException(String topicName) {
        super("Topic " + topicName + " already exists");

        this.topicName = topicName;
    }

    public String getTopicName() {
        return topicName;
    }
}
