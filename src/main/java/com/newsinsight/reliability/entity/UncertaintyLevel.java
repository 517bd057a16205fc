package com.newsinsight.reliability.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative confidence in an assessment, driven by evidence volume.
 */
public enum UncertaintyLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    UncertaintyLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
