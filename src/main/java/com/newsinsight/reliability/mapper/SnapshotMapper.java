package com.newsinsight.reliability.mapper;

import com.newsinsight.reliability.dto.AssessmentResponse;
import com.newsinsight.reliability.dto.ComponentsDto;
import com.newsinsight.reliability.dto.DomainComparisonResponse;
import com.newsinsight.reliability.dto.SnapshotResponse;
import com.newsinsight.reliability.entity.ReliabilitySnapshot;
import com.newsinsight.reliability.scoring.CompositeResult;
import com.newsinsight.reliability.scoring.ReliabilityAssessment;
import com.newsinsight.reliability.scoring.ScoreComponents;
import com.newsinsight.reliability.service.ImpactMetricEstimator;
import com.newsinsight.reliability.store.DomainAggregate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps snapshots and assessments to API responses.
 */
@Component
public class SnapshotMapper {

    public SnapshotResponse toResponse(ReliabilitySnapshot snapshot) {
        return SnapshotResponse.builder()
                .sourceId(snapshot.getSource().getId())
                .sourceName(snapshot.getSource().getName())
                .domain(snapshot.getDomain())
                .useCase(snapshot.getUseCase())
                .score(snapshot.getScore())
                .band(snapshot.getBand())
                .components(toDto(snapshot.getComponents()))
                .uncertainty(snapshot.getUncertainty())
                .reasons(List.copyOf(snapshot.getReasons()))
                .referenceImpactMetric(snapshot.getReferenceImpactMetric())
                .version(snapshot.getVersion())
                .date(snapshot.getSnapshotDate())
                .build();
    }

    public DomainComparisonResponse toResponse(DomainAggregate aggregate) {
        return new DomainComparisonResponse(
                aggregate.domain(),
                aggregate.sourceCount(),
                aggregate.avgScore(),
                aggregate.topSourceName(),
                aggregate.topScore(),
                aggregate.snapshotDate());
    }

    public AssessmentResponse toResponse(ReliabilityAssessment assessment) {
        CompositeResult result = assessment.result();
        Map<String, Map<String, Object>> details = new LinkedHashMap<>();
        assessment.details().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> details.put(entry.getKey().getValue(), entry.getValue()));

        return AssessmentResponse.builder()
                .sourceName(assessment.sourceName())
                .domain(assessment.domain())
                .useCase(assessment.useCase())
                .score(result.score())
                .band(result.band())
                .components(toDto(result.components()))
                .componentDetails(details)
                .uncertainty(result.uncertainty())
                .reasons(result.reasons())
                .evidenceCount(assessment.evidenceCount())
                .referenceImpactMetric(assessment.referenceImpactMetric())
                .referenceTier(ImpactMetricEstimator.tierLabel(assessment.referenceImpactMetric()))
                .version(assessment.version())
                .computedAt(assessment.computedAt())
                .build();
    }

    private static ComponentsDto toDto(ScoreComponents components) {
        return new ComponentsDto(
                components.authority(),
                components.relevance(),
                components.freshness(),
                components.guideline(),
                components.rigor());
    }
}
