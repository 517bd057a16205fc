package com.newsinsight.reliability.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intent context that selects a weight profile.
 *
 * - CLINICAL: decision-grade use, authority and guideline presence dominate
 * - EXPLORATORY: early or mechanistic research, relevance and freshness dominate
 */
public enum UseCase {
    CLINICAL("clinical"),
    EXPLORATORY("exploratory");

    private final String value;

    UseCase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a use case value, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static UseCase fromValue(String value) {
        if (value != null) {
            for (UseCase useCase : values()) {
                if (useCase.value.equalsIgnoreCase(value.trim())) {
                    return useCase;
                }
            }
        }
        throw new IllegalArgumentException("Unknown use case: " + value);
    }
}
