package com.gt.tsrs.topic.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

// Stored form of a topic. The topic name is the key of the enclosing JSON object.
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileTopicRecord(@JsonProperty("description") String description,
                              @JsonProperty("created_at") String createdAt,
                              @JsonProperty("last_review_at") @JsonAlias("last_review") String lastReviewAt,
                              @JsonProperty("next_review_at") @JsonAlias("next_review") String nextReviewAt,
                              @JsonProperty("interval_index") Integer intervalIndex,
                              @JsonProperty("review_count") Integer reviewCount,
                              @JsonProperty("success_streak") Integer successStreak,
                              @JsonProperty("total_successes") Integer totalSuccesses,
                              @JsonProperty("total_reviews") Integer totalReviews) { }
