package com.gt.tsrs.notification;

import com.gt.tsrs.model.Topic;

import java.util.List;
import java.util.stream.Collectors;

public class DueReviewMessage {

    public static final String TITLE = "Topics due for review";

    static final int MAX_LISTED_TOPICS = 5;

    public static String buildMessage(List<Topic> dueTopics) {
        String names = dueTopics.stream()
                .limit(MAX_LISTED_TOPICS)
                .map(Topic::name)
                .collect(Collectors.joining(", "));

        String message = dueTopics.size() + (dueTopics.size() == 1 ? " topic is" : " topics are") + " due for review: " + names;
        if (dueTopics.size() > MAX_LISTED_TOPICS) {
            message += " and " + (dueTopics.size() - MAX_LISTED_TOPICS) + " more";
        }

        return message;
    }
}
