package com.newsinsight.reliability.dto;

public record ComponentsDto(
        double authority,
        double relevance,
        double freshness,
        double guideline,
        double rigor
) {
}
