package com.gt.tsrs.notification.impl;

import com.gt.tsrs.model.Topic;
import com.gt.tsrs.notification.DueReviewMessage;
import com.gt.tsrs.notification.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

// Used where no desktop notification command is available
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(List<Topic> dueTopics) {
        log.info("{}: {}", DueReviewMessage.TITLE, DueReviewMessage.buildMessage(dueTopics));
    }
}
