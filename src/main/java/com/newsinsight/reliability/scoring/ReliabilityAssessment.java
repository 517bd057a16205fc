package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.entity.UseCase;

import java.time.Instant;
import java.util.Map;

/**
 * Full result of one assessment pipeline call.
 */
public record ReliabilityAssessment(
        String sourceName,
        String domain,
        UseCase useCase,
        CompositeResult result,
        Map<ScoreComponent, Map<String, Object>> details,
        int evidenceCount,
        Double referenceImpactMetric,
        String version,
        Instant computedAt
) {
    public ReliabilityAssessment {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
