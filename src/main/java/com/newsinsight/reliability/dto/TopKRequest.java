package com.newsinsight.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsinsight.reliability.entity.UseCase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Top-K query. {@code date} is YYYY-MM-DD and defaults to today; {@code limit} defaults to 25.
 */
public record TopKRequest(
        @NotBlank(message = "domain is required") @Size(max = 100) String domain,
        @NotNull(message = "use_case is required") @JsonProperty("use_case") UseCase useCase,
        String date,
        Integer limit
) {
}
