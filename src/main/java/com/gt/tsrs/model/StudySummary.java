package com.gt.tsrs.model;

public record StudySummary(int totalTopics,
                           int dueNow,
                           int dueToday,
                           int masteredTopics,
                           double averageSuccessRatePercent) { }
