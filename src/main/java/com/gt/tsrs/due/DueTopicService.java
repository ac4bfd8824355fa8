package com.gt.tsrs.due;

import com.gt.tsrs.exception.InvalidTopicException;
import com.gt.tsrs.exception.TopicNotFoundException;
import com.gt.tsrs.ladder.IntervalLadder;
import com.gt.tsrs.model.MasteryLevel;
import com.gt.tsrs.model.StudySummary;
import com.gt.tsrs.model.Topic;
import com.gt.tsrs.model.TopicStats;
import com.gt.tsrs.review.MasteryClassifier;
import com.gt.tsrs.topic.TopicDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

// Read-only queries over the stored topics. Nothing here changes a topic.
@Component
public class DueTopicService {

    private static final Logger log = LoggerFactory.getLogger(DueTopicService.class);

    // Earliest next review first is the same as most overdue first for a fixed "now"
    private static final Comparator<Topic> MOST_OVERDUE_FIRST = Comparator
            .comparing(Topic::nextReviewAt)
            .thenComparing(Topic::name);

    private final TopicDao topicDao;
    private final MasteryClassifier masteryClassifier;
    private final IntervalLadder intervalLadder;
    private final Clock clock;

    @Autowired
    public DueTopicService(TopicDao topicDao, MasteryClassifier masteryClassifier, IntervalLadder intervalLadder, Clock clock) {
        this.topicDao = topicDao;
        this.masteryClassifier = masteryClassifier;
        this.intervalLadder = intervalLadder;
        this.clock = clock;
    }

    public List<Topic> listAll() {
        return topicDao.loadTopics()
                .stream()
                .sorted(Comparator.comparing(Topic::name))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<Topic> listDue() {
        return listDue(clock.instant());
    }

    public List<Topic> listDue(Instant now) {
        return listDueBefore(topicDao.loadTopics(), now);
    }

    public List<Topic> listDueWithin(Instant now, int days) {
        if (days < 0) {
            throw new InvalidTopicException("Days ahead must not be negative");
        }

        return listDueBefore(topicDao.loadTopics(), now.plus(Duration.ofDays(days)));
    }

    public MasteryLevel classify(Topic topic) {
        return masteryClassifier.classify(topic);
    }

    public TopicStats getTopicStats(String name, Instant now) {
        for (Topic topic : topicDao.loadTopics()) {
            if (topic.name().equals(name)) {
                return buildTopicStats(topic, now);
            }
        }

        throw new TopicNotFoundException(name);
    }

    public List<TopicStats> getAllTopicStats(Instant now) {
        return listAll().stream()
                .map(topic -> buildTopicStats(topic, now))
                .collect(Collectors.toUnmodifiableList());
    }

    public StudySummary getStudySummary(Instant now) {
        List<Topic> topics = topicDao.loadTopics();
        if (topics.isEmpty()) {
            return new StudySummary(0, 0, 0, 0, 0);
        }

        Instant endOfToday = endOfDay(now);
        int dueNow = 0;
        int dueToday = 0;
        int masteredTopics = 0;
        long totalReviews = 0;
        long totalSuccesses = 0;

        for (Topic topic : topics) {
            if (!topic.nextReviewAt().isAfter(now)) {
                dueNow++;
            }
            if (!topic.nextReviewAt().isAfter(endOfToday)) {
                dueToday++;
            }
            if (masteryClassifier.classify(topic) == MasteryLevel.Mastered) {
                masteredTopics++;
            }

            totalReviews += topic.totalReviews();
            totalSuccesses += topic.totalSuccesses();
        }

        double averageSuccessRate = totalReviews == 0 ? 0 : toPercent((double) totalSuccesses / totalReviews);
        log.debug("Study summary: {} topics, {} due now, {} due today", topics.size(), dueNow, dueToday);

        return new StudySummary(topics.size(), dueNow, dueToday, masteredTopics, averageSuccessRate);
    }

    private static List<Topic> listDueBefore(List<Topic> topics, Instant cutoff) {
        return topics.stream()
                .filter(topic -> !topic.nextReviewAt().isAfter(cutoff))
                .sorted(MOST_OVERDUE_FIRST)
                .collect(Collectors.toUnmodifiableList());
    }

    private TopicStats buildTopicStats(Topic topic, Instant now) {
        ZoneId zone = clock.getZone();
        long daysUntilReview = Math.max(0, Duration.between(now, topic.nextReviewAt()).toDays());

        return new TopicStats(
                topic.name(),
                topic.description(),
                toPercent(topic.successRate()),
                topic.successStreak(),
                topic.totalReviews(),
                intervalLadder.getInterval(topic.intervalIndex()).toDays(),
                daysUntilReview,
                LocalDate.ofInstant(topic.nextReviewAt(), zone),
                masteryClassifier.classify(topic));
    }

    private Instant endOfDay(Instant now) {
        ZoneId zone = clock.getZone();
        return LocalDate.ofInstant(now, zone).plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
    }

    private static double toPercent(double rate) {
        return Math.round(rate * 1000) / 10.0;
    }
}
