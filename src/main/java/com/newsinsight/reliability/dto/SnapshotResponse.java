package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;
import com.newsinsight.reliability.entity.UseCase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * One ranked snapshot row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotResponse {

    @JsonProperty("source_id")
    private Long sourceId;

    @JsonProperty("source_name")
    private String sourceName;

    private String domain;

    @JsonProperty("use_case")
    private UseCase useCase;

    private double score;

    private ReliabilityBand band;

    private ComponentsDto components;

    private UncertaintyLevel uncertainty;

    private List<String> reasons;

    @JsonProperty("reference_impact_metric")
    private Double referenceImpactMetric;

    private String version;

    private LocalDate date;
}
