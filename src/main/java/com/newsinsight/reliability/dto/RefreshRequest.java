package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.UseCase;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RefreshRequest(
        @NotEmpty(message = "domain_list is required")
        @Size(max = 10, message = "domain_list accepts at most 10 domains")
        @JsonProperty("domain_list") List<String> domainList,
        @JsonProperty("use_cases") List<UseCase> useCases,
        @JsonProperty("force_recompute") Boolean forceRecompute
) {
    public RefreshRequest {
        useCases = useCases == null ? List.of() : List.copyOf(useCases);
        forceRecompute = forceRecompute != null && forceRecompute;
    }
}
