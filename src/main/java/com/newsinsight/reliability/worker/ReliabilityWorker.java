package com.newsinsight.reliability.worker;

import com.newsinsight.reliability.config.ReliabilityProperties;
import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import com.newsinsight.reliability.entity.UseCase;
import com.newsinsight.reliability.exception.ComputationException;
import com.newsinsight.reliability.exception.WorkerAbortedException;
import com.newsinsight.reliability.repository.EvidenceItemRepository;
import com.newsinsight.reliability.scoring.ReliabilityAssessment;
import com.newsinsight.reliability.scoring.ReliabilityAssessor;
import com.newsinsight.reliability.service.SourceRef;
import com.newsinsight.reliability.service.SourceRegistry;
import com.newsinsight.reliability.store.SnapshotKey;
import com.newsinsight.reliability.store.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recomputes reliability snapshots for domains × sources with evidence × use cases.
 *
 * Each domain is scored first and then committed as one batch. A failure scoring or writing one
 * item is logged and counted; a failure to list domains or to open or commit a domain transaction
 * aborts the run and reports the domains left unprocessed.
 * The run can be interrupted between domains.
 */
@Service
@Slf4j
public class ReliabilityWorker {

    private final EvidenceItemRepository evidenceRepository;
    private final SourceRegistry sourceRegistry;
    private final ReliabilityAssessor assessor;
    private final SnapshotStore snapshotStore;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final List<String> defaultDomains;
    private final int evidenceLimit;
    private final AtomicInteger activeRuns = new AtomicInteger();

    public ReliabilityWorker(EvidenceItemRepository evidenceRepository,
                             SourceRegistry sourceRegistry,
                             ReliabilityAssessor assessor,
                             SnapshotStore snapshotStore,
                             PlatformTransactionManager transactionManager,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             ScoringProperties scoringProperties,
                             ReliabilityProperties properties) {
        this.evidenceRepository = evidenceRepository;
        this.sourceRegistry = sourceRegistry;
        this.assessor = assessor;
        this.snapshotStore = snapshotStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.defaultDomains = List.copyOf(properties.getWorker().getDefaultDomains());
        this.evidenceLimit = scoringProperties.getEvidenceLimit();
    }

    public boolean isRunning() {
        return activeRuns.get() > 0;
    }

    public WorkerReport run(WorkerRequest request) {
        LocalDate targetDate = request.targetDate() != null ? request.targetDate() : LocalDate.now(clock);
        Instant startedAt = Instant.now(clock);
        List<UseCase> useCases = orderedUseCases(request.useCases());
        Timer.Sample sample = Timer.start(meterRegistry);
        activeRuns.incrementAndGet();

        log.info("Starting reliability computation: date={}, domainFilter={}, useCases={}, force={}",
                targetDate, request.domains().isEmpty() ? "all" : request.domains(), useCases, request.force());

        Counts totals = new Counts();
        List<String> processed = new ArrayList<>();
        List<String> domains = List.of();
        try {
            try {
                domains = resolveDomains(request.domains());
            } catch (RuntimeException e) {
                WorkerReport partial = finish(report(targetDate, totals, processed, request.domains(), false, startedAt), sample);
                log.error("Reliability worker aborted: could not list domains: {}", e.getMessage(), e);
                throw new WorkerAbortedException("Could not list domains: " + e.getMessage(),
                        request.domains(), partial, e);
            }
            log.info("Processing domains: {}", domains);

            for (int i = 0; i < domains.size(); i++) {
                String domain = domains.get(i);
                if (Thread.currentThread().isInterrupted()) {
                    List<String> remaining = domains.subList(i, domains.size());
                    log.warn("Reliability worker interrupted, {} domains left unprocessed: {}", remaining.size(), remaining);
                    return finish(report(targetDate, totals, processed, remaining, true, startedAt), sample);
                }

                Counts domainCounts = new Counts();
                try {
                    List<PendingWrite> pending = scoreDomain(domain, useCases, targetDate, request.force(), domainCounts);
                    commitDomain(domain, pending, domainCounts);
                } catch (RuntimeException e) {
                    List<String> remaining = domains.subList(i, domains.size());
                    WorkerReport partial = finish(report(targetDate, totals, processed, remaining, false, startedAt), sample);
                    log.error("Reliability worker aborted at domain '{}': unprocessed domains {}: {}",
                            domain, remaining, e.getMessage(), e);
                    throw new WorkerAbortedException("Failed to commit domain '" + domain + "': " + e.getMessage(),
                            remaining, partial, e);
                }
                totals.add(domainCounts);
                processed.add(domain);
                log.info("Committed domain '{}': computed={}, skipped={}, errored={}",
                        domain, domainCounts.computed, domainCounts.skipped, domainCounts.errored);
            }

            WorkerReport report = report(targetDate, totals, processed, List.of(), false, startedAt);
            log.info("Reliability computation completed: date={}, computed={}, skipped={}, errored={}, domains={}",
                    targetDate, report.computed(), report.skipped(), report.errored(), processed.size());
            return finish(report, sample);
        } finally {
            activeRuns.decrementAndGet();
        }
    }

    /**
     * Scores every (source, use case) pair of a domain outside any transaction, so a failing
     * read or calculator only costs its own item.
     */
    private List<PendingWrite> scoreDomain(String domain, List<UseCase> useCases, LocalDate targetDate,
                                           boolean force, Counts counts) {
        List<String> sourceNames = evidenceRepository.findDistinctSourceNamesByDomain(domain);
        log.info("Domain '{}': {} sources with evidence", domain, sourceNames.size());

        List<PendingWrite> pending = new ArrayList<>();
        for (String sourceName : sourceNames) {
            SourceRef source;
            try {
                source = sourceRegistry.lookupOrCreate(sourceName);
            } catch (RuntimeException e) {
                for (UseCase useCase : useCases) {
                    recordError(new ComputationException(sourceName, domain, useCase, e), counts);
                }
                continue;
            }

            List<EvidenceItem> evidence = null;
            for (UseCase useCase : useCases) {
                try {
                    SnapshotKey key = new SnapshotKey(source.id(), domain, useCase, targetDate);
                    if (!force && snapshotStore.exists(key)) {
                        counts.skipped++;
                        continue;
                    }
                    if (evidence == null) {
                        evidence = evidenceRepository.findBySourceAndDomain(
                                sourceName, domain, PageRequest.of(0, evidenceLimit));
                    }
                    ReliabilityAssessment assessment = assessor.assess(
                            sourceName, domain, useCase, evidence, source.referenceImpactMetric());
                    pending.add(new PendingWrite(sourceName, key, assessment));
                } catch (RuntimeException e) {
                    recordError(new ComputationException(sourceName, domain, useCase, e), counts);
                }
            }
        }
        return pending;
    }

    /**
     * Writes the domain's snapshots in one transaction. When that batch is rejected by a write
     * rather than by the transaction itself, each snapshot is written on its own so one bad row
     * does not cost the others. Transaction failures propagate and abort the run.
     */
    private void commitDomain(String domain, List<PendingWrite> pending, Counts counts) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (PendingWrite write : pending) {
                    snapshotStore.upsert(write.key(), write.assessment());
                }
            });
            counts.computed += pending.size();
            return;
        } catch (RuntimeException e) {
            if (isFatal(e)) {
                throw e;
            }
            log.warn("Batch write for domain '{}' rejected, writing {} snapshots individually: {}",
                    domain, pending.size(), e.getMessage());
        }

        for (PendingWrite write : pending) {
            try {
                snapshotStore.upsert(write.key(), write.assessment());
                counts.computed++;
                log.debug("Upserted {} | {} | {} score={}", write.sourceName(), domain,
                        write.key().useCase().getValue(), write.assessment().result().score());
            } catch (RuntimeException e) {
                if (isFatal(e)) {
                    throw e;
                }
                // a cached source id may point at a row that no longer exists
                sourceRegistry.evict(write.sourceName());
                recordError(new ComputationException(write.sourceName(), domain, write.key().useCase(), e), counts);
            }
        }
    }

    private static boolean isFatal(RuntimeException e) {
        return e instanceof CannotCreateTransactionException || e instanceof TransactionSystemException;
    }

    private void recordError(ComputationException error, Counts counts) {
        counts.errored++;
        log.warn("{}", error.getMessage());
    }

    private List<String> resolveDomains(List<String> filter) {
        Set<String> domains = new LinkedHashSet<>();
        if (!filter.isEmpty()) {
            filter.stream()
                    .filter(domain -> domain != null && !domain.isBlank())
                    .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                    .forEach(domains::add);
            return List.copyOf(domains);
        }
        evidenceRepository.findDistinctDomains().stream()
                .filter(domain -> domain != null && !domain.isBlank())
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .forEach(domains::add);
        if (domains.isEmpty()) {
            log.info("No domains found in evidence, using default list");
            return defaultDomains;
        }
        return List.copyOf(domains);
    }

    private static List<UseCase> orderedUseCases(Set<UseCase> requested) {
        List<UseCase> ordered = new ArrayList<>();
        for (UseCase useCase : UseCase.values()) {
            if (requested.contains(useCase)) {
                ordered.add(useCase);
            }
        }
        return ordered;
    }

    private WorkerReport report(LocalDate targetDate, Counts totals, List<String> processed,
                                List<String> unprocessed, boolean interrupted, Instant startedAt) {
        return new WorkerReport(targetDate, totals.computed, totals.skipped, totals.errored,
                processed, unprocessed, interrupted, startedAt, Instant.now(clock));
    }

    private WorkerReport finish(WorkerReport report, Timer.Sample sample) {
        sample.stop(meterRegistry.timer("reliability.worker.run"));
        meterRegistry.counter("reliability.worker.items", "outcome", "computed").increment(report.computed());
        meterRegistry.counter("reliability.worker.items", "outcome", "skipped").increment(report.skipped());
        meterRegistry.counter("reliability.worker.items", "outcome", "errored").increment(report.errored());
        return report;
    }

    private record PendingWrite(String sourceName, SnapshotKey key, ReliabilityAssessment assessment) {
    }

    private static final class Counts {
        private int computed;
        private int skipped;
        private int errored;

        void add(Counts other) {
            computed += other.computed;
            skipped += other.skipped;
            errored += other.errored;
        }
    }
}
