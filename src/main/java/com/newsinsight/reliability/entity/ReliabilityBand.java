package com.newsinsight.reliability.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human-readable confidence label derived from the composite score.
 *
 * - HIGH: 0.80 - 1.00
 * - MODERATE: 0.60 - 0.79
 * - EXPLORATORY: 0.40 - 0.59
 * - LOW: 0.00 - 0.39
 */
public enum ReliabilityBand {
    HIGH("high"),
    MODERATE("moderate"),
    EXPLORATORY("exploratory"),
    LOW("low");

    private final String value;

    ReliabilityBand(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
