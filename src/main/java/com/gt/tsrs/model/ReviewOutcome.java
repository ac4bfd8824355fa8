package com.gt.tsrs.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.tsrs.serialization.ReviewOutcomeDeserializer;
import com.gt.tsrs.serialization.ReviewOutcomeSerializer;

@JsonSerialize(using = ReviewOutcomeSerializer.class)
@JsonDeserialize(using = ReviewOutcomeDeserializer.class)
public enum ReviewOutcome {
    Success("success"),
    Failure("failure");

    private final String value;

    ReviewOutcome(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ReviewOutcome fromValue(String value) {
        if (value != null) {
            for (ReviewOutcome reviewOutcome : values()) {
                if (reviewOutcome.value.equalsIgnoreCase(value.trim())) {
                    return reviewOutcome;
                }
            }
        }

        return null;
    }
}
