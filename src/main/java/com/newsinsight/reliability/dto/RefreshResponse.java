package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.UseCase;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RefreshResponse(
        int computed,
        int skipped,
        int errored,
        @JsonProperty("domain_list") List<String> domainList,
        @JsonProperty("use_cases") List<UseCase> useCases,
        LocalDate date,
        Instant timestamp
) {
}
