package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.UseCase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssessRequest(
        @NotBlank(message = "source_name is required")
        @Size(max = 200, message = "source_name must be at most 200 characters")
        @JsonProperty("source_name") String sourceName,
        @NotBlank(message = "domain is required")
        @Size(max = 100, message = "domain must be at most 100 characters")
        String domain,
        @NotNull(message = "use_case is required")
        @JsonProperty("use_case") UseCase useCase
) {
}
