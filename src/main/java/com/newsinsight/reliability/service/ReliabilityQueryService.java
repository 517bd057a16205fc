package com.newsinsight.reliability.service;

import com.newsinsight.reliability.config.ReliabilityProperties;
import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.dto.AssessmentResponse;
import com.newsinsight.reliability.dto.DomainComparisonResponse;
import com.newsinsight.reliability.dto.RefreshResponse;
import com.newsinsight.reliability.dto.SnapshotResponse;
import com.newsinsight.reliability.entity.EvidenceItem;
import com.newsinsight.reliability.entity.UseCase;
import com.newsinsight.reliability.exception.ValidationException;
import com.newsinsight.reliability.mapper.SnapshotMapper;
import com.newsinsight.reliability.repository.EvidenceItemRepository;
import com.newsinsight.reliability.scoring.ReliabilityAssessment;
import com.newsinsight.reliability.scoring.ReliabilityAssessor;
import com.newsinsight.reliability.store.SnapshotStore;
import com.newsinsight.reliability.store.TopKResult;
import com.newsinsight.reliability.worker.ReliabilityWorker;
import com.newsinsight.reliability.worker.WorkerReport;
import com.newsinsight.reliability.worker.WorkerRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read side of the reliability engine plus the administrative refresh.
 *
 * Reads never write snapshots. Refresh runs the batch worker synchronously for the given
 * domains and today's date.
 */
@Service
@Slf4j
public class ReliabilityQueryService {

    static final int MAX_SOURCE_NAME_LENGTH = 200;
    static final int MAX_DOMAIN_LENGTH = 100;

    private final SnapshotStore snapshotStore;
    private final SnapshotMapper snapshotMapper;
    private final ReliabilityWorker worker;
    private final ReliabilityAssessor assessor;
    private final SourceRegistry sourceRegistry;
    private final EvidenceItemRepository evidenceRepository;
    private final ReliabilityProperties.Query queryConfig;
    private final int evidenceLimit;
    private final Clock clock;
    private final Counter fallbackCounter;

    public ReliabilityQueryService(SnapshotStore snapshotStore,
                                   SnapshotMapper snapshotMapper,
                                   ReliabilityWorker worker,
                                   ReliabilityAssessor assessor,
                                   SourceRegistry sourceRegistry,
                                   EvidenceItemRepository evidenceRepository,
                                   ReliabilityProperties properties,
                                   ScoringProperties scoringProperties,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.snapshotStore = snapshotStore;
        this.snapshotMapper = snapshotMapper;
        this.worker = worker;
        this.assessor = assessor;
        this.sourceRegistry = sourceRegistry;
        this.evidenceRepository = evidenceRepository;
        this.queryConfig = properties.getQuery();
        this.evidenceLimit = scoringProperties.getEvidenceLimit();
        this.clock = clock;
        this.fallbackCounter = Counter.builder("reliability.query.fallbacks")
                .description("Top-K reads served from an earlier snapshot date")
                .register(meterRegistry);
    }

    /**
     * Best sources for a domain and use case on a date, falling back to the latest earlier date.
     *
     * @param date  YYYY-MM-DD, today when null or blank
     * @param limit 1..100, 25 when null
     */
    @Transactional(readOnly = true)
    public List<SnapshotResponse> topK(String domain, UseCase useCase, String date, Integer limit) {
        String domainKey = requireDomain(domain);
        if (useCase == null) {
            throw ValidationException.required("use_case");
        }
        int effectiveLimit = limit == null ? queryConfig.getDefaultLimit() : limit;
        if (effectiveLimit < 1 || effectiveLimit > queryConfig.getMaxLimit()) {
            log.debug("Rejected top-K limit {}", effectiveLimit);
            throw ValidationException.outOfRange("limit", effectiveLimit, 1, queryConfig.getMaxLimit());
        }
        LocalDate requested = parseDate(date);

        TopKResult result = snapshotStore.findTopK(domainKey, useCase, requested, effectiveLimit);
        if (result.isFallback()) {
            fallbackCounter.increment();
            log.info("Top-K for {} / {}: requested {}, served {}", domainKey, useCase.getValue(),
                    result.requestedDate(), result.servedDate());
        }
        return result.rows().stream().map(snapshotMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<DomainComparisonResponse> compareDomains(String useCase, String date) {
        UseCase parsed = parseUseCase(useCase);
        LocalDate requested = parseDate(date);
        return snapshotStore.compareDomains(parsed, requested).stream()
                .map(snapshotMapper::toResponse)
                .toList();
    }

    /**
     * Synchronous recompute of today's snapshots for up to ten domains.
     */
    public RefreshResponse refresh(List<String> domainList, List<UseCase> useCases, boolean forceRecompute) {
        if (domainList == null || domainList.isEmpty()) {
            throw ValidationException.required("domain_list");
        }
        if (domainList.size() > queryConfig.getMaxRefreshDomains()) {
            throw ValidationException.outOfRange("domain_list size", domainList.size(), 1, queryConfig.getMaxRefreshDomains());
        }
        Set<String> domains = new LinkedHashSet<>();
        for (String domain : domainList) {
            domains.add(requireDomain(domain));
        }
        Set<UseCase> selected = useCases == null || useCases.isEmpty()
                ? EnumSet.allOf(UseCase.class)
                : EnumSet.copyOf(useCases);

        LocalDate today = LocalDate.now(clock);
        log.info("Manual refresh requested: domains={}, useCases={}, force={}", domains, selected, forceRecompute);
        WorkerReport report = worker.run(new WorkerRequest(today, new ArrayList<>(domains), selected, forceRecompute));

        return new RefreshResponse(
                report.computed(),
                report.skipped(),
                report.errored(),
                report.processedDomains(),
                List.copyOf(selected),
                today,
                Instant.now(clock));
    }

    /**
     * Scores one source against live evidence without storing a snapshot.
     */
    public AssessmentResponse assess(String sourceName, String domain, UseCase useCase) {
        if (sourceName == null || sourceName.isBlank()) {
            throw ValidationException.required("source_name");
        }
        if (sourceName.length() > MAX_SOURCE_NAME_LENGTH) {
            throw new ValidationException("source_name must be at most " + MAX_SOURCE_NAME_LENGTH + " characters");
        }
        String domainKey = requireDomain(domain);
        if (useCase == null) {
            throw ValidationException.required("use_case");
        }

        String name = sourceName.trim();
        SourceRef source = sourceRegistry.lookupOrCreate(name);
        List<EvidenceItem> evidence = evidenceRepository.findBySourceAndDomain(name, domainKey, PageRequest.of(0, evidenceLimit));
        ReliabilityAssessment assessment = assessor.assess(name, domainKey, useCase, evidence, source.referenceImpactMetric());
        log.debug("Assessed '{}' for {} / {}: score={}", name, domainKey, useCase.getValue(), assessment.result().score());
        return snapshotMapper.toResponse(assessment);
    }

    private String requireDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw ValidationException.required("domain");
        }
        if (domain.length() > MAX_DOMAIN_LENGTH) {
            throw new ValidationException("domain must be at most " + MAX_DOMAIN_LENGTH + " characters");
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            log.debug("Rejected date '{}'", date);
            throw new ValidationException("Invalid date format: " + date + ". Use YYYY-MM-DD", e);
        }
    }

    private static UseCase parseUseCase(String useCase) {
        if (useCase == null || useCase.isBlank()) {
            return UseCase.CLINICAL;
        }
        try {
            return UseCase.fromValue(useCase);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("use_case must be 'clinical' or 'exploratory', got '" + useCase + "'", e);
        }
    }
}
