package com.gt.tsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class TopicNotFoundException extends RuntimeException {

    private final String topicName;

    public TopicNotFoundException(String topicName) {
        super("Topic " + topicName + " does not exist");

        this.topicName = topicName;
    }

    public String getTopicName() {
        return topicName;
    }
}
