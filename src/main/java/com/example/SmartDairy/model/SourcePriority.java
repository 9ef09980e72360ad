package com.example.SmartDairy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tier attached to sources of a hybrid answer: uploaded documents rank above web results.
 */
public enum SourcePriority {
    HIGH("high"),
    MEDIUM("medium");

    private final String value;

    SourcePriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
