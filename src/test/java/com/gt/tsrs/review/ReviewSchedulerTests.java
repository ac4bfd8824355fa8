package com.gt.tsrs.review;

import com.gt.tsrs.model.ReviewOutcome;
import com.gt.tsrs.model.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.gt.tsrs.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReviewSchedulerTests {

    private ReviewScheduler reviewScheduler;

    @BeforeEach
    public void setup() {
        reviewScheduler = new ReviewScheduler(TEST_LADDER);
    }

    @Test
    public void testCreateTopic() {
        Topic topic = reviewScheduler.createTopic("Calculus", "Limits and derivatives", day(0));

        assertEquals("Calculus", topic.name());
        assertEquals("Limits and derivatives", topic.description());
        assertEquals(day(0), topic.createdAt());
        assertEquals(day(0), topic.lastReviewAt());
        assertEquals(day(1), topic.nextReviewAt());
        assertEquals(0, topic.intervalIndex());
        assertEquals(0, topic.reviewCount());
        assertEquals(0, topic.successStreak());
        assertEquals(0, topic.totalSuccesses());
        assertEquals(0, topic.totalReviews());
    }

    @Test
    public void testCreateTopicWithoutDescription() {
        assertEquals("", reviewScheduler.createTopic("Calculus", null, day(0)).description());
    }

    @Test
    public void testReviewSequence() {
        Topic topic = reviewScheduler.createTopic("Calculus", "...", day(0));

        topic = reviewScheduler.markReview(topic, ReviewOutcome.Success, day(1));
        assertEquals(1, topic.intervalIndex());
        assertEquals(day(4), topic.nextReviewAt());
        assertEquals(1, topic.successStreak());

        topic = reviewScheduler.markReview(topic, ReviewOutcome.Success, day(4));
        assertEquals(2, topic.intervalIndex());
        assertEquals(day(9), topic.nextReviewAt());
        assertEquals(2, topic.successStreak());

        topic = reviewScheduler.markReview(topic, ReviewOutcome.Failure, day(9));
        assertEquals(1, topic.intervalIndex());
        assertEquals(day(12), topic.nextReviewAt());
        assertEquals(day(9), topic.lastReviewAt());
        assertEquals(0, topic.successStreak());
        assertEquals(2, topic.totalSuccesses());
        assertEquals(3, topic.totalReviews());
        assertEquals(3, topic.reviewCount());
        assertEquals(day(0), topic.createdAt());
    }

    @Test
    public void testSuccessSaturatesAtTopRung() {
        Topic topic = reviewScheduler.createTopic("Algebra", "", day(0));

        for (int i = 0; i < 20; i++) {
            topic = reviewScheduler.markReview(topic, ReviewOutcome.Success, day(i));
            assertTrue(topic.intervalIndex() <= TEST_LADDER.maxIndex());
        }

        assertEquals(TEST_LADDER.maxIndex(), topic.intervalIndex());
        assertEquals(day(19 + 88), topic.nextReviewAt());
        assertEquals(20, topic.successStreak());
        assertEquals(20, topic.totalSuccesses());
    }

    @Test
    public void testFailureSaturatesAtBottomRung() {
        Topic topic = reviewScheduler.createTopic("Algebra", "", day(0));

        for (int i = 0; i < 5; i++) {
            topic = reviewScheduler.markReview(topic, ReviewOutcome.Failure, day(i));
            assertEquals(0, topic.intervalIndex());
        }

        assertEquals(day(5), topic.nextReviewAt());
        assertEquals(0, topic.totalSuccesses());
        assertEquals(5, topic.totalReviews());
    }

    @Test
    public void testOutcomesAreMonotonic() {
        for (int index = 0; index <= TEST_LADDER.maxIndex(); index++) {
            Topic topic = buildTopic("Topic", day(0), index, 3, 5);

            assertTrue(reviewScheduler.markReview(topic, ReviewOutcome.Success, day(1)).intervalIndex() >= index);
            assertTrue(reviewScheduler.markReview(topic, ReviewOutcome.Failure, day(1)).intervalIndex() <= index);
        }
    }

    @Test
    public void testInvariantsHoldAfterMixedReviews() {
        Topic topic = reviewScheduler.createTopic("Physics", "", day(0));
        ReviewOutcome[] outcomes = { ReviewOutcome.Success, ReviewOutcome.Failure, ReviewOutcome.Success, ReviewOutcome.Success,
                ReviewOutcome.Failure, ReviewOutcome.Failure, ReviewOutcome.Failure, ReviewOutcome.Success };

        long reviewDay = 0;
        for (ReviewOutcome outcome : outcomes) {
            reviewDay += 2;
            topic = reviewScheduler.markReview(topic, outcome, day(reviewDay));

            assertTrue(topic.intervalIndex() >= 0 && topic.intervalIndex() <= TEST_LADDER.maxIndex());
            assertEquals(TEST_LADDER.nextReviewTime(topic.lastReviewAt(), topic.intervalIndex()), topic.nextReviewAt());
            assertTrue(topic.totalSuccesses() <= topic.totalReviews());
            assertEquals(topic.reviewCount(), topic.totalReviews());
        }

        assertEquals(1, topic.successStreak());
        assertEquals(4, topic.totalSuccesses());
        assertEquals(8, topic.totalReviews());
    }

    @Test
    public void testEarlyReviewIsAccepted() {
        Topic topic = reviewScheduler.createTopic("History", "", day(0));

        Topic reviewed = reviewScheduler.markReview(topic, ReviewOutcome.Success, day(0).plusSeconds(60));

        assertEquals(1, reviewed.intervalIndex());
        assertEquals(day(3).plusSeconds(60), reviewed.nextReviewAt());
    }

    @Test
    public void testMissingOutcome() {
        Topic topic = reviewScheduler.createTopic("History", "", day(0));

        assertThrows(IllegalArgumentException.class, () -> reviewScheduler.markReview(topic, null, day(1)));
    }
}
