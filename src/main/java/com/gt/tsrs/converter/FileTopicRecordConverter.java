package com.gt.tsrs.converter;

import com.gt.tsrs.exception.InvalidStateException;
import com.gt.tsrs.ladder.IntervalLadder;
import com.gt.tsrs.model.Topic;
import com.gt.tsrs.topic.model.FileTopicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

public class FileTopicRecordConverter {

    private static final Logger log = LoggerFactory.getLogger(FileTopicRecordConverter.class);

    public static FileTopicRecord convertTopic(Topic topic) {
        return new FileTopicRecord(
                topic.description(),
                topic.createdAt().toString(),
                topic.lastReviewAt().toString(),
                topic.nextReviewAt().toString(),
                topic.intervalIndex(),
                topic.reviewCount(),
                topic.successStreak(),
                topic.totalSuccesses(),
                topic.totalReviews());
    }

    // Builds a topic from a stored record, repairing invariant violations where the record still has
    // enough data to do so. Throws InvalidStateException when it does not.
    public static Topic convertFileTopicRecord(String name, FileTopicRecord record, IntervalLadder intervalLadder) {
        if (name == null || name.isBlank()) {
            throw new InvalidStateException("Stored topic has a blank name");
        }
        if (record == null) {
            throw new InvalidStateException("Stored topic " + name + " has no data");
        }

        Instant createdAt = parseTimestamp(name, "created_at", record.createdAt(), true);
        Instant lastReviewAt = parseTimestamp(name, "last_review_at", record.lastReviewAt(), false);
        if (lastReviewAt == null) {
            lastReviewAt = createdAt;
        }

        int intervalIndex = requireCount(name, "interval_index", record.intervalIndex(), false);
        int reviewCount = requireCount(name, "review_count", record.reviewCount(), true);
        int successStreak = requireCount(name, "success_streak", record.successStreak(), true);
        int totalSuccesses = requireCount(name, "total_successes", record.totalSuccesses(), true);
        int totalReviews = requireCount(name, "total_reviews", record.totalReviews(), true);

        if (intervalIndex != intervalLadder.clampIndex(intervalIndex)) {
            log.warn("Topic {} has interval index {} outside the ladder, clamping", name, intervalIndex);
            intervalIndex = intervalLadder.clampIndex(intervalIndex);
        }

        if (reviewCount != totalReviews) {
            log.warn("Topic {} has review count {} but total reviews {}, using the larger", name, reviewCount, totalReviews);
            reviewCount = Math.max(reviewCount, totalReviews);
            totalReviews = reviewCount;
        }

        if (totalSuccesses > totalReviews) {
            log.warn("Topic {} has more successes ({}) than reviews ({}), capping", name, totalSuccesses, totalReviews);
            totalSuccesses = totalReviews;
        }

        if (successStreak > totalSuccesses) {
            log.warn("Topic {} has a success streak ({}) longer than its successes ({}), capping", name, successStreak, totalSuccesses);
            successStreak = totalSuccesses;
        }

        Instant expectedNextReviewAt;
        try {
            expectedNextReviewAt = intervalLadder.nextReviewTime(lastReviewAt, intervalIndex);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new InvalidStateException("Stored topic " + name + " has a next review past the supported time range", ex);
        }
        Instant nextReviewAt = parseTimestamp(name, "next_review_at", record.nextReviewAt(), false);
        if (!expectedNextReviewAt.equals(nextReviewAt)) {
            log.warn("Topic {} has next review {} but its ladder position requires {}, recomputing", name, nextReviewAt, expectedNextReviewAt);
        }

        return new Topic(
                name,
                record.description() == null ? "" : record.description(),
                createdAt,
                lastReviewAt,
                expectedNextReviewAt,
                intervalIndex,
                reviewCount,
                successStreak,
                totalSuccesses,
                totalReviews);
    }

    // Accepts ISO-8601 instants, and local date-times without an offset (read as UTC) from older stores
    static Instant parseTimestamp(String name, String field, String value, boolean required) {
        if (value == null || value.isBlank()) {
            if (required) {
                throw new InvalidStateException("Stored topic " + name + " is missing " + field);
            }
            return null;
        }

        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException localEx) {
                if (required) {
                    throw new InvalidStateException("Stored topic " + name + " has unreadable " + field + " '" + value + "'", localEx);
                }

                log.warn("Topic {} has unreadable {} '{}', ignoring", name, field, value);
                return null;
            }
        }
    }

    private static int requireCount(String name, String field, Integer value, boolean nonNegative) {
        if (value == null) {
            throw new InvalidStateException("Stored topic " + name + " is missing " + field);
        }

        if (nonNegative && value < 0) {
            log.warn("Topic {} has negative {} ({}), resetting to 0", name, field, value);
            return 0;
        }

        return value;
    }
}
