package com.gt.tsrs.topic;

import com.gt.tsrs.exception.DuplicateTopicException;
import com.gt.tsrs.exception.InvalidTopicException;
import com.gt.tsrs.exception.TopicNotFoundException;
import com.gt.tsrs.model.AddTopicsResult;
import com.gt.tsrs.model.ReviewOutcome;
import com.gt.tsrs.model.Topic;
import com.gt.tsrs.model.TopicDraft;
import com.gt.tsrs.review.ReviewScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Owns every change to the stored topics. Each mutation locks the store, loads it, applies the change
 * and saves it before releasing the lock, so nothing outside this class holds topics that can drift
 * from what is stored.
 */
@Component
public class TopicService {

    private static final Logger log = LoggerFactory.getLogger(TopicService.class);

    public static final int MAX_NAME_LENGTH = 200;

    private final TopicDao topicDao;
    private final ReviewScheduler reviewScheduler;
    private final Clock clock;

    @Autowired
    public TopicService(TopicDao topicDao, ReviewScheduler reviewScheduler, Clock clock) {
        this.topicDao = topicDao;
        this.reviewScheduler = reviewScheduler;
        this.clock = clock;
    }

    public List<Topic> loadTopics() {
        return topicDao.loadTopics();
    }

    public Topic getTopic(String name) {
        Topic topic = findTopic(topicDao.loadTopics(), name);
        if (topic == null) {
            throw new TopicNotFoundException(name);
        }

        return topic;
    }

    public Topic addTopic(String name, String description) {
        return addTopic(name, description, clock.instant());
    }

    public Topic addTopic(String name, String description, Instant now) {
        validateTopicName(name);

        try (TopicStoreLock lock = topicDao.lockStore()) {
            Map<String, Topic> topicsByName = toTopicsByName(topicDao.loadTopics());
            if (topicsByName.containsKey(name)) {
                throw new DuplicateTopicException(name);
            }

            Topic topic = reviewScheduler.createTopic(name, description, now);
            topicsByName.put(name, topic);
            topicDao.saveTopics(topicsByName.values());

            log.info("Added topic {}, first review at {}", name, topic.nextReviewAt());
            return topic;
        }
    }

    public AddTopicsResult addTopics(List<TopicDraft> drafts) {
        return addTopics(drafts, clock.instant());
    }

    // Existing names are skipped, never overwritten
    public AddTopicsResult addTopics(List<TopicDraft> drafts, Instant now) {
        if (drafts == null || drafts.isEmpty()) {
            return new AddTopicsResult(List.of(), List.of());
        }
        for (TopicDraft draft : drafts) {
            validateTopicName(draft.name());
        }

        try (TopicStoreLock lock = topicDao.lockStore()) {
            Map<String, Topic> topicsByName = toTopicsByName(topicDao.loadTopics());
            List<Topic> added = new ArrayList<>();
            List<String> skipped = new ArrayList<>();

            for (TopicDraft draft : drafts) {
                if (topicsByName.containsKey(draft.name())) {
                    skipped.add(draft.name());
                } else {
                    Topic topic = reviewScheduler.createTopic(draft.name(), draft.description(), now);
                    topicsByName.put(draft.name(), topic);
                    added.add(topic);
                }
            }

            if (!added.isEmpty()) {
                topicDao.saveTopics(topicsByName.values());
            }

            log.info("Added {} topics, skipped {} existing", added.size(), skipped.size());
            return new AddTopicsResult(List.copyOf(added), List.copyOf(skipped));
        }
    }

    public Topic markReview(String name, ReviewOutcome outcome) {
        return markReview(name, outcome, clock.instant());
    }

    public Topic markReview(String name, ReviewOutcome outcome, Instant now) {
        if (outcome == null) {
            throw new InvalidTopicException("Review outcome is required");
        }

        try (TopicStoreLock lock = topicDao.lockStore()) {
            Map<String, Topic> topicsByName = toTopicsByName(topicDao.loadTopics());
            Topic topic = topicsByName.get(name);
            if (topic == null) {
                throw new TopicNotFoundException(name);
            }

            Topic reviewedTopic = reviewScheduler.markReview(topic, outcome, now);
            topicsByName.put(name, reviewedTopic);
            topicDao.saveTopics(topicsByName.values());

            log.info("Recorded {} review for topic {}: interval index {} -> {}, next review at {}",
                    outcome.getValue(), name, topic.intervalIndex(), reviewedTopic.intervalIndex(), reviewedTopic.nextReviewAt());
            return reviewedTopic;
        }
    }

    public void removeTopic(String name) {
        try (TopicStoreLock lock = topicDao.lockStore()) {
            Map<String, Topic> topicsByName = toTopicsByName(topicDao.loadTopics());
            if (topicsByName.remove(name) == null) {
                throw new TopicNotFoundException(name);
            }

            topicDao.saveTopics(topicsByName.values());
            log.info("Removed topic {}", name);
        }
    }

    static void validateTopicName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidTopicException("Topic name must not be blank");
        }
        if (name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            throw new InvalidTopicException("Topic name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private static Topic findTopic(List<Topic> topics, String name) {
        for (Topic topic : topics) {
            if (topic.name().equals(name)) {
                return topic;
            }
        }

        return null;
    }

    private static Map<String, Topic> toTopicsByName(List<Topic> topics) {
        Map<String, Topic> topicsByName = new LinkedHashMap<>();
        for (Topic topic : topics) {
            topicsByName.put(topic.name(), topic);
        }

        return topicsByName;
    }
}
