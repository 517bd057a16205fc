package com.newsinsight.reliability.controller;

import com.newsinsight.reliability.dto.AssessRequest;
import com.newsinsight.reliability.dto.AssessmentResponse;
import com.newsinsight.reliability.dto.DomainComparisonResponse;
import com.newsinsight.reliability.dto.RefreshRequest;
import com.newsinsight.reliability.dto.RefreshResponse;
import com.newsinsight.reliability.dto.SnapshotResponse;
import com.newsinsight.reliability.dto.TopKRequest;
import com.newsinsight.reliability.service.ReliabilityQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Reliability rankings, domain comparison, refresh and live assessment.
 * Repository work is blocking and runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/reliability")
@RequiredArgsConstructor
@Slf4j
public class ReliabilityController {

    private final ReliabilityQueryService queryService;

    /**
     * Top sources for a domain and use case, ordered by composite score.
     */
    @PostMapping("/top")
    public Mono<ResponseEntity<List<SnapshotResponse>>> top(@Valid @RequestBody TopKRequest request) {
        return Mono.fromCallable(() -> queryService.topK(
                        request.domain(), request.useCase(), request.date(), request.limit()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/domain-comparison")
    public Mono<ResponseEntity<List<DomainComparisonResponse>>> domainComparison(
            @RequestParam(name = "use_case", defaultValue = "clinical") String useCase,
            @RequestParam(name = "date", required = false) String date
    ) {
        return Mono.fromCallable(() -> queryService.compareDomains(useCase, date))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * Recompute today's snapshots for the given domains. Expensive; runs synchronously.
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<RefreshResponse>> refresh(@Valid @RequestBody RefreshRequest request) {
        log.info("Refresh requested for domains: {}", request.domainList());
        return Mono.fromCallable(() -> queryService.refresh(
                        request.domainList(), request.useCases(), request.forceRecompute()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/assess")
    public Mono<ResponseEntity<AssessmentResponse>> assess(@Valid @RequestBody AssessRequest request) {
        return Mono.fromCallable(() -> queryService.assess(
                        request.sourceName(), request.domain(), request.useCase()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
