package com.gt.tsrs.due;

import com.gt.tsrs.exception.InvalidTopicException;
import com.gt.tsrs.exception.TopicNotFoundException;
import com.gt.tsrs.model.*;
import com.gt.tsrs.review.MasteryClassifier;
import com.gt.tsrs.topic.TopicDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.gt.tsrs.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class DueTopicServiceTests {

    // Calculus after success at day 1, success at day 4 and failure at day 9
    private static final Topic CALCULUS = new Topic("Calculus", "...", day(0), day(9), day(12), 1, 3, 0, 2, 3);

    private DueTopicService dueTopicService;

    @Mock private TopicDao topicDao;

    @BeforeEach
    public void setup() {
        dueTopicService = new DueTopicService(topicDao, new MasteryClassifier(), TEST_LADDER, Clock.fixed(day(12), ZoneOffset.UTC));
    }

    @Test
    public void testListDueWhenDue() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        assertEquals(List.of(CALCULUS), dueTopicService.listDue(day(12)));
    }

    @Test
    public void testListDueBeforeDue() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        assertEquals(List.of(), dueTopicService.listDue(day(11)));
        assertEquals(List.of(), dueTopicService.listDue(day(12).minusNanos(1)));
    }

    @Test
    public void testListDueUsesClock() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        assertEquals(List.of(CALCULUS), dueTopicService.listDue());
    }

    @Test
    public void testListDueOrdersMostOverdueFirst() {
        Topic algebra = buildTopic("Algebra", day(0), 0, 0, 0);          // due day 1
        Topic biology = buildTopic("Biology", day(2), 1, 1, 1);          // due day 5
        Topic chemistry = buildTopic("Chemistry", day(0), 2, 2, 2);      // due day 5
        Topic physics = buildTopic("Physics", day(10), 3, 3, 3);         // due day 21
        Topic history = buildTopic("History", day(1), 1, 1, 1);          // due day 4
        when(topicDao.loadTopics()).thenReturn(List.of(physics, chemistry, algebra, history, biology));

        List<Topic> dueTopics = dueTopicService.listDue(day(20));

        assertEquals(List.of(algebra, history, biology, chemistry), dueTopics);

        Instant now = day(20);
        for (int i = 1; i < dueTopics.size(); i++) {
            Duration previousOverdue = Duration.between(dueTopics.get(i - 1).nextReviewAt(), now);
            Duration overdue = Duration.between(dueTopics.get(i).nextReviewAt(), now);
            assertTrue(previousOverdue.compareTo(overdue) >= 0);
        }
        for (Topic topic : dueTopics) {
            assertFalse(topic.nextReviewAt().isAfter(now));
        }
    }

    @Test
    public void testListDueWithin() {
        Topic algebra = buildTopic("Algebra", day(0), 0, 0, 0);          // due day 1
        Topic biology = buildTopic("Biology", day(2), 1, 1, 1);          // due day 5
        Topic physics = buildTopic("Physics", day(10), 3, 3, 3);         // due day 21
        when(topicDao.loadTopics()).thenReturn(List.of(physics, biology, algebra));

        assertEquals(List.of(algebra), dueTopicService.listDueWithin(day(3), 0));
        assertEquals(List.of(algebra, biology), dueTopicService.listDueWithin(day(3), 2));
        assertEquals(List.of(algebra, biology, physics), dueTopicService.listDueWithin(day(3), 30));
        assertThrows(InvalidTopicException.class, () -> dueTopicService.listDueWithin(day(3), -1));
    }

    @Test
    public void testListAll() {
        Topic algebra = buildTopic("Algebra", day(0), 0, 0, 0);
        Topic physics = buildTopic("Physics", day(10), 3, 3, 3);
        when(topicDao.loadTopics()).thenReturn(List.of(physics, algebra));

        assertEquals(List.of(algebra, physics), dueTopicService.listAll());
    }

    @Test
    public void testQueriesNeverWrite() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        dueTopicService.listAll();
        dueTopicService.listDue(day(20));
        dueTopicService.listDueWithin(day(20), 3);
        dueTopicService.getStudySummary(day(20));
        dueTopicService.getAllTopicStats(day(20));

        verify(topicDao, never()).saveTopics(any());
        verify(topicDao, never()).lockStore();
    }

    @Test
    public void testGetTopicStats() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        TopicStats topicStats = dueTopicService.getTopicStats("Calculus", day(10));

        assertEquals("Calculus", topicStats.name());
        assertEquals("...", topicStats.description());
        assertEquals(66.7, topicStats.successRatePercent());
        assertEquals(0, topicStats.successStreak());
        assertEquals(3, topicStats.totalReviews());
        assertEquals(3, topicStats.currentIntervalDays());
        assertEquals(2, topicStats.daysUntilReview());
        assertEquals(LocalDate.of(1970, 1, 13), topicStats.nextReviewDate());
        assertEquals(MasteryLevel.Beginner, topicStats.masteryLevel());
    }

    @Test
    public void testGetTopicStatsWhenOverdue() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        assertEquals(0, dueTopicService.getTopicStats("Calculus", day(40)).daysUntilReview());
    }

    @Test
    public void testGetTopicStatsUnknownTopic() {
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS));

        assertThrows(TopicNotFoundException.class, () -> dueTopicService.getTopicStats("Algebra", day(10)));
    }

    @Test
    public void testGetStudySummary() {
        Topic mastered = buildTopic("Algebra", day(0), 6, 9, 10);        // due day 88
        Topic dueLaterToday = new Topic("Biology", "", day(0), day(11).plusSeconds(3600 * 20), day(12).plusSeconds(3600 * 20), 0, 1, 0, 0, 1);
        when(topicDao.loadTopics()).thenReturn(List.of(CALCULUS, mastered, dueLaterToday));

        StudySummary studySummary = dueTopicService.getStudySummary(day(12).plusSeconds(3600));

        assertEquals(3, studySummary.totalTopics());
        assertEquals(1, studySummary.dueNow());
        assertEquals(2, studySummary.dueToday());
        assertEquals(1, studySummary.masteredTopics());
        assertEquals(78.6, studySummary.averageSuccessRatePercent());
    }

    @Test
    public void testGetStudySummaryWithoutTopics() {
        when(topicDao.loadTopics()).thenReturn(List.of());

        assertEquals(new StudySummary(0, 0, 0, 0, 0), dueTopicService.getStudySummary(day(12)));
    }

    @Test
    public void testClassify() {
        assertEquals(MasteryLevel.Beginner, dueTopicService.classify(CALCULUS));
    }
}
