package com.gt.tsrs.model;

import java.time.Instant;

public record Topic(String name,
                    String description,
                    Instant createdAt,
                    Instant lastReviewAt,
                    Instant nextReviewAt,
                    int intervalIndex,
                    int reviewCount,
                    int successStreak,
                    int totalSuccesses,
                    int totalReviews) {

    public double successRate() {
        return totalReviews == 0 ? 0 : (double) totalSuccesses / totalReviews;
    }
}
