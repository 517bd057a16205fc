package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DomainComparisonResponse(
        String domain,
        @JsonProperty("source_count") long sourceCount,
        @JsonProperty("avg_score") double avgScore,
        @JsonProperty("top_source_name") String topSourceName,
        @JsonProperty("top_score") double topScore,
        @JsonProperty("snapshot_date") LocalDate snapshotDate
) {
}
