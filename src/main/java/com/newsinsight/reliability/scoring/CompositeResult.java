package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;

import java.util.List;
import java.util.Objects;

/**
 * Weighted score with its band, uncertainty and explanation.
 */
public record CompositeResult(
        double score,
        ReliabilityBand band,
        ScoreComponents components,
        UncertaintyLevel uncertainty,
        List<String> reasons
) {
    public CompositeResult {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Composite score must be within [0, 1], got " + score);
        }
        Objects.requireNonNull(band, "band must not be null");
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(uncertainty, "uncertainty must not be null");
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        if (reasons.isEmpty() || reasons.size() > CompositeScorer.MAX_REASONS) {
            throw new IllegalArgumentException("Expected 1.." + CompositeScorer.MAX_REASONS + " reasons, got " + reasons.size());
        }
    }
}
