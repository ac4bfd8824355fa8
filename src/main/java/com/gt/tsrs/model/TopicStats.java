package com.gt.tsrs.model;

import java.time.LocalDate;

public record TopicStats(String name,
                         String description,
                         double successRatePercent,
                         int successStreak,
                         int totalReviews,
                         long currentIntervalDays,
                         long daysUntilReview,
                         LocalDate nextReviewDate,
                         MasteryLevel masteryLevel) { }
