package com.gt.tsrs.review;

import com.gt.tsrs.ladder.IntervalLadder;
import com.gt.tsrs.model.ReviewOutcome;
import com.gt.tsrs.model.Topic;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Moves a topic along the interval ladder. A success climbs one rung and a failure drops one rung,
 * both saturating at the ends of the ladder. Reviews are accepted at any time, including before the
 * topic is due.
 */
@Component
public class ReviewScheduler {

    private final IntervalLadder intervalLadder;

    @Autowired
    public ReviewScheduler(IntervalLadder intervalLadder) {
        this.intervalLadder = intervalLadder;
    }

    public Topic createTopic(String name, String description, Instant now) {
        return new Topic(
                name,
                description == null ? "" : description,
                now,
                now,
                intervalLadder.nextReviewTime(now, 0),
                0,
                0,
                0,
                0,
                0);
    }

    public Topic markReview(Topic topic, ReviewOutcome outcome, Instant now) {
        if (outcome == null) {
            throw new IllegalArgumentException("Review outcome is required");
        }

        int intervalIndex = nextIntervalIndex(topic.intervalIndex(), outcome);
        boolean success = outcome == ReviewOutcome.Success;

        return new Topic(
                topic.name(),
                topic.description(),
                topic.createdAt(),
                now,
                intervalLadder.nextReviewTime(now, intervalIndex),
                intervalIndex,
                topic.reviewCount() + 1,
                success ? topic.successStreak() + 1 : 0,
                success ? topic.totalSuccesses() + 1 : topic.totalSuccesses(),
                topic.totalReviews() + 1);
    }

    public int nextIntervalIndex(int intervalIndex, ReviewOutcome outcome) {
        return switch (outcome) {
            case Success -> Math.min(intervalIndex + 1, intervalLadder.maxIndex());
            case Failure -> Math.max(intervalIndex - 1, 0);
        };
    }

    public IntervalLadder getIntervalLadder() {
        return intervalLadder;
    }
}
