package com.gt.tsrs.notification;

import com.gt.tsrs.due.DueTopicService;
import com.gt.tsrs.model.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

// Only reads due topics; a failing notifier is logged here and never reaches the scheduler
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final DueTopicService dueTopicService;
    private final Notifier notifier;

    @Autowired
    public NotificationDispatcher(DueTopicService dueTopicService, Notifier notifier) {
        this.dueTopicService = dueTopicService;
        this.notifier = notifier;
    }

    public int dispatchDueReviews(Instant now) {
        List<Topic> dueTopics = dueTopicService.listDue(now);
        if (dueTopics.isEmpty()) {
            log.debug("No topics due at {}", now);
            return 0;
        }

        try {
            notifier.notify(dueTopics);
        } catch (RuntimeException ex) {
            log.warn("Unable to send notification for {} due topics", dueTopics.size(), ex);
        }

        return dueTopics.size();
    }
}
