package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;
import com.newsinsight.reliability.entity.UseCase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Live assessment of one source; nothing is persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentResponse {

    @JsonProperty("source_name")
    private String sourceName;

    private String domain;

    @JsonProperty("use_case")
    private UseCase useCase;

    private double score;

    private ReliabilityBand band;

    private ComponentsDto components;

    /** Inputs and intermediate values per component, keyed by component name. */
    @JsonProperty("component_details")
    private Map<String, Map<String, Object>> componentDetails;

    private UncertaintyLevel uncertainty;

    private List<String> reasons;

    @JsonProperty("evidence_count")
    private int evidenceCount;

    @JsonProperty("reference_impact_metric")
    private Double referenceImpactMetric;

    @JsonProperty("reference_tier")
    private String referenceTier;

    private String version;

    @JsonProperty("computed_at")
    private Instant computedAt;
}
