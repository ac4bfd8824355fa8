package com.gt.tsrs.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.tsrs.serialization.MasteryLevelSerializer;

@JsonSerialize(using = MasteryLevelSerializer.class)
public enum MasteryLevel {
    Learning("Learning"),
    Beginner("Beginner"),
    Intermediate("Intermediate"),
    Advanced("Advanced"),
    Mastered("Mastered");

    private final String label;

    MasteryLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
