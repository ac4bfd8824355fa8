package com.gt.tsrs.review;

import com.gt.tsrs.model.MasteryLevel;
import com.gt.tsrs.model.Topic;
import org.springframework.stereotype.Component;

@Component
public class MasteryClassifier {

    static final int MASTERED_MIN_INDEX = 5;
    static final double MASTERED_MIN_SUCCESS_RATE = 0.80;
    static final int ADVANCED_MIN_INDEX = 3;
    static final double ADVANCED_MIN_SUCCESS_RATE = 0.70;
    static final int INTERMEDIATE_MIN_INDEX = 2;
    static final double INTERMEDIATE_MIN_SUCCESS_RATE = 0.60;
    static final int BEGINNER_MIN_INDEX = 1;

    public MasteryLevel classify(Topic topic) {
        return classify(topic.intervalIndex(), topic.totalSuccesses(), topic.totalReviews());
    }

    // Rules are checked from the highest level down; the first match wins
    public MasteryLevel classify(int intervalIndex, int totalSuccesses, int totalReviews) {
        double successRate = totalReviews == 0 ? 0 : (double) totalSuccesses / totalReviews;

        if (intervalIndex >= MASTERED_MIN_INDEX && successRate >= MASTERED_MIN_SUCCESS_RATE) {
            return MasteryLevel.Mastered;
        } else if (intervalIndex >= ADVANCED_MIN_INDEX && successRate >= ADVANCED_MIN_SUCCESS_RATE) {
            return MasteryLevel.Advanced;
        } else if (intervalIndex >= INTERMEDIATE_MIN_INDEX && successRate >= INTERMEDIATE_MIN_SUCCESS_RATE) {
            return MasteryLevel.Intermediate;
        } else if (intervalIndex >= BEGINNER_MIN_INDEX) {
            return MasteryLevel.Beginner;
        }

        return MasteryLevel.Learning;
    }
}
