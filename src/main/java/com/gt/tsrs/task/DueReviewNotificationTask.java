package com.gt.tsrs.task;

import com.gt.tsrs.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class DueReviewNotificationTask {

    private static final Logger log = LoggerFactory.getLogger(DueReviewNotificationTask.class);

    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final boolean enabled;

    public DueReviewNotificationTask(NotificationDispatcher notificationDispatcher,
                                     Clock clock,
                                     @Value("${tsrs.notification.enabled:false}") boolean enabled) {
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${tsrs.notification.intervalMs:3600000}", initialDelayString = "${tsrs.notification.initialDelayMs:60000}")
    public void notifyDueReviews() {
        if (!enabled) {
            return;
        }

        try {
            int dueCnt = notificationDispatcher.dispatchDueReviews(clock.instant());
            log.info("Checked due reviews. {} topics due.", dueCnt);
        } catch (RuntimeException ex) {
            log.error("Unable to check due reviews", ex);
        }
    }
}
