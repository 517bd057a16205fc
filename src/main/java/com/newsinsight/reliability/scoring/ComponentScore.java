package com.newsinsight.reliability.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a single calculator: the score plus the inputs and intermediate values behind it.
 */
public record ComponentScore(double score, Map<String, Object> detail) {

    public ComponentScore {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Component score must be within [0, 1], got " + score);
        }
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }
}
