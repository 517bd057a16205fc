package com.newsinsight.reliability.controller;

import com.newsinsight.reliability.dto.ComponentsDto;
import com.newsinsight.reliability.dto.DomainComparisonResponse;
import com.newsinsight.reliability.dto.RefreshResponse;
import com.newsinsight.reliability.dto.SnapshotResponse;
import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;
import com.newsinsight.reliability.entity.UseCase;
import com.newsinsight.reliability.exception.NotFoundException;
import com.newsinsight.reliability.exception.ValidationException;
import com.newsinsight.reliability.exception.WorkerAbortedException;
import com.newsinsight.reliability.service.ReliabilityQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(ReliabilityController.class)
class ReliabilityControllerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 15);

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ReliabilityQueryService queryService;

    @Test
    @DisplayName("POST /top returns ranked snapshots in snake_case")
    void top() {
        // given
        when(queryService.topK("oncology", UseCase.CLINICAL, null, 5)).thenReturn(List.of(
                SnapshotResponse.builder()
                        .sourceId(1L)
                        .sourceName("Journal of Clinical Oncology")
                        .domain("oncology")
                        .useCase(UseCase.CLINICAL)
                        .score(0.919)
                        .band(ReliabilityBand.HIGH)
                        .components(new ComponentsDto(1.0, 0.9, 0.533, 0.9, 0.75))
                        .uncertainty(UncertaintyLevel.MEDIUM)
                        .reasons(List.of("Highly reliable source for clinical use"))
                        .version("v2")
                        .date(DATE)
                        .build()));

        // when & then
        webTestClient.post().uri("/api/v1/reliability/top")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain\":\"oncology\",\"use_case\":\"clinical\",\"limit\":5}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].source_name").isEqualTo("Journal of Clinical Oncology")
                .jsonPath("$[0].use_case").isEqualTo("clinical")
                .jsonPath("$[0].band").isEqualTo("high")
                .jsonPath("$[0].uncertainty").isEqualTo("medium")
                .jsonPath("$[0].components.guideline").isEqualTo(0.9)
                .jsonPath("$[0].date").isEqualTo("2024-06-15");
    }

    @Test
    @DisplayName("Out-of-range limit maps to 400")
    void topInvalidLimit() {
        when(queryService.topK("oncology", UseCase.CLINICAL, null, 0))
                .thenThrow(ValidationException.outOfRange("limit", 0, 1, 100));

        webTestClient.post().uri("/api/v1/reliability/top")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain\":\"oncology\",\"use_case\":\"clinical\",\"limit\":0}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.status").isEqualTo(400);
    }

    @Test
    @DisplayName("Unknown domain maps to 404")
    void topNotFound() {
        when(queryService.topK("nonexistent_domain", UseCase.CLINICAL, null, null))
                .thenThrow(NotFoundException.noSnapshots("nonexistent_domain", UseCase.CLINICAL));

        webTestClient.post().uri("/api/v1/reliability/top")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain\":\"nonexistent_domain\",\"use_case\":\"clinical\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("Missing fields and unknown enum values are rejected before the service")
    void topMalformed() {
        webTestClient.post().uri("/api/v1/reliability/top")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"use_case\":\"clinical\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        webTestClient.post().uri("/api/v1/reliability/top")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain\":\"oncology\",\"use_case\":\"diagnostic\"}")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("GET /domain-comparison defaults the use case to clinical")
    void domainComparison() {
        when(queryService.compareDomains("clinical", null)).thenReturn(List.of(
                new DomainComparisonResponse("oncology", 12, 0.712, "Journal of Clinical Oncology", 0.919, DATE)));

        webTestClient.get().uri("/api/v1/reliability/domain-comparison")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].domain").isEqualTo("oncology")
                .jsonPath("$[0].source_count").isEqualTo(12)
                .jsonPath("$[0].avg_score").isEqualTo(0.712)
                .jsonPath("$[0].top_source_name").isEqualTo("Journal of Clinical Oncology");
    }

    @Test
    @DisplayName("POST /refresh passes domains, use cases and the force flag")
    void refresh() {
        when(queryService.refresh(eq(List.of("oncology")), eq(List.of(UseCase.EXPLORATORY)), eq(true)))
                .thenReturn(new RefreshResponse(4, 0, 1, List.of("oncology"), List.of(UseCase.EXPLORATORY),
                        DATE, Instant.parse("2024-06-15T10:00:00Z")));

        webTestClient.post().uri("/api/v1/reliability/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain_list\":[\"oncology\"],\"use_cases\":[\"exploratory\"],\"force_recompute\":true}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.computed").isEqualTo(4)
                .jsonPath("$.errored").isEqualTo(1)
                .jsonPath("$.domain_list[0]").isEqualTo("oncology")
                .jsonPath("$.use_cases[0]").isEqualTo("exploratory");
    }

    @Test
    @DisplayName("Refresh without domains is a 400, oversized lists too")
    void refreshValidation() {
        webTestClient.post().uri("/api/v1/reliability/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain_list\":[]}")
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.post().uri("/api/v1/reliability/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain_list\":[\"a\",\"b\",\"c\",\"d\",\"e\",\"f\",\"g\",\"h\",\"i\",\"j\",\"k\"]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("domain_list"));

        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("Aborted refresh reports unprocessed domains with a 500")
    void refreshAborted() {
        when(queryService.refresh(any(), any(), anyBoolean())).thenThrow(new WorkerAbortedException(
                "Failed to commit domain 'neurology'", List.of("neurology"), null, new IllegalStateException("db")));

        webTestClient.post().uri("/api/v1/reliability/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"domain_list\":[\"oncology\",\"neurology\"]}")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("WORKER_ABORTED")
                .jsonPath("$.unprocessedDomains[0]").isEqualTo("neurology");
    }

    @Test
    @DisplayName("Unexpected failures map to a generic 500")
    void unexpectedFailure() {
        when(queryService.compareDomains(eq("exploratory"), isNull())).thenThrow(new IllegalStateException("boom"));

        webTestClient.get().uri("/api/v1/reliability/domain-comparison?use_case=exploratory")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INTERNAL_ERROR")
                .jsonPath("$.message").isEqualTo("An unexpected error occurred");

        verify(queryService).compareDomains("exploratory", null);
    }
}
