package com.newsinsight.reliability.store;

import com.newsinsight.reliability.config.ReliabilityProperties;
import com.newsinsight.reliability.entity.ReliabilitySnapshot;
import com.newsinsight.reliability.entity.StringListJsonConverter;
import com.newsinsight.reliability.entity.UseCase;
import com.newsinsight.reliability.exception.NotFoundException;
import com.newsinsight.reliability.exception.StorageConflictException;
import com.newsinsight.reliability.repository.ReliabilitySnapshotRepository;
import com.newsinsight.reliability.repository.SourceRepository;
import com.newsinsight.reliability.scoring.CompositeResult;
import com.newsinsight.reliability.scoring.ReliabilityAssessment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Snapshot store over JPA, with a native atomic upsert on PostgreSQL.
 *
 * ATOMIC issues {@code INSERT ... ON CONFLICT DO UPDATE} on the snapshot key. READ_MODIFY_WRITE
 * reads the key and updates or inserts, serialized per key inside this process; a writer that
 * still loses the race to another process hits the unique constraint and is retried.
 * Retries only apply outside a caller's transaction, since a failed statement poisons it.
 */
@Component
@Slf4j
public class JpaSnapshotStore implements SnapshotStore {

    private static final int LOCK_STRIPES = 64;

    private static final String UPSERT_SQL = """
            INSERT INTO reliability_snapshots (
                source_id, domain, use_case, snapshot_date, score, band,
                authority, relevance, freshness, guideline, rigor,
                uncertainty, reasons, reference_impact_metric, version, created_at, updated_at)
            VALUES (
                :sourceId, :domain, :useCase, :snapshotDate, :score, :band,
                :authority, :relevance, :freshness, :guideline, :rigor,
                :uncertainty, :reasons, :referenceImpactMetric, :version, :now, :now)
            ON CONFLICT (source_id, domain, use_case, snapshot_date) DO UPDATE SET
                score = EXCLUDED.score,
                band = EXCLUDED.band,
                authority = EXCLUDED.authority,
                relevance = EXCLUDED.relevance,
                freshness = EXCLUDED.freshness,
                guideline = EXCLUDED.guideline,
                rigor = EXCLUDED.rigor,
                uncertainty = EXCLUDED.uncertainty,
                reasons = EXCLUDED.reasons,
                reference_impact_metric = EXCLUDED.reference_impact_metric,
                version = EXCLUDED.version,
                updated_at = EXCLUDED.updated_at
            """;

    private final ReliabilitySnapshotRepository snapshotRepository;
    private final SourceRepository sourceRepository;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final StringListJsonConverter reasonsConverter = new StringListJsonConverter();
    private final Counter conflictCounter;
    private final UpsertMode mode;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public JpaSnapshotStore(ReliabilitySnapshotRepository snapshotRepository,
                            SourceRepository sourceRepository,
                            DataSource dataSource,
                            PlatformTransactionManager transactionManager,
                            ReliabilityProperties properties,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.sourceRepository = sourceRepository;
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.getStore().getConflictMaxAttempts()))
                .retryOn(List.of(StorageConflictException.class, DataIntegrityViolationException.class))
                .fixedBackoff(50)
                .build();
        this.conflictCounter = Counter.builder("reliability.snapshot.conflicts")
                .description("Snapshot upserts retried after a concurrent write")
                .register(meterRegistry);
        this.clock = clock;
        this.mode = resolveMode(properties.getStore().getUpsertMode(), dataSource);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        log.info("Snapshot store initialized: upsertMode={}", mode);
    }

    @Override
    public UpsertMode getEffectiveMode() {
        return mode;
    }

    @Override
    public void upsert(SnapshotKey key, ReliabilityAssessment assessment) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            write(key, assessment);
            return;
        }
        retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                conflictCounter.increment();
                log.debug("Retrying snapshot upsert for {} (attempt {})", key, context.getRetryCount() + 1);
            }
            if (mode == UpsertMode.ATOMIC) {
                transactionTemplate.executeWithoutResult(status -> atomicUpsert(key, assessment));
            } else {
                // the lock spans the commit so the next writer for this key reads the committed row
                synchronized (lockFor(key)) {
                    transactionTemplate.executeWithoutResult(status -> readModifyWrite(key, assessment));
                }
            }
            return null;
        });
    }

    private void write(SnapshotKey key, ReliabilityAssessment assessment) {
        if (mode == UpsertMode.ATOMIC) {
            atomicUpsert(key, assessment);
            return;
        }
        synchronized (lockFor(key)) {
            readModifyWrite(key, assessment);
        }
    }

    private void atomicUpsert(SnapshotKey key, ReliabilityAssessment assessment) {
        CompositeResult result = assessment.result();
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("sourceId", key.sourceId())
                .addValue("domain", key.domain())
                .addValue("useCase", key.useCase().name())
                .addValue("snapshotDate", key.date())
                .addValue("score", result.score())
                .addValue("band", result.band().name())
                .addValue("authority", result.components().authority())
                .addValue("relevance", result.components().relevance())
                .addValue("freshness", result.components().freshness())
                .addValue("guideline", result.components().guideline())
                .addValue("rigor", result.components().rigor())
                .addValue("uncertainty", result.uncertainty().name())
                .addValue("reasons", reasonsConverter.convertToDatabaseColumn(result.reasons()))
                .addValue("referenceImpactMetric", assessment.referenceImpactMetric())
                .addValue("version", assessment.version())
                .addValue("now", now);
        jdbcTemplate.update(UPSERT_SQL, params);
        log.debug("Upserted snapshot {} score={}", key, result.score());
    }

    private void readModifyWrite(SnapshotKey key, ReliabilityAssessment assessment) {
        Optional<ReliabilitySnapshot> existing =
                snapshotRepository.findByKey(key.sourceId(), key.domain(), key.useCase(), key.date());
        ReliabilitySnapshot snapshot = existing.orElseGet(() -> ReliabilitySnapshot.builder()
                .source(sourceRepository.getReferenceById(key.sourceId()))
                .domain(key.domain())
                .useCase(key.useCase())
                .snapshotDate(key.date())
                .build());
        apply(snapshot, assessment);
        try {
            snapshotRepository.saveAndFlush(snapshot);
        } catch (DataIntegrityViolationException e) {
            throw new StorageConflictException(key, e);
        }
        log.debug("{} snapshot {} score={}", existing.isPresent() ? "Updated" : "Created", key, snapshot.getScore());
    }

    private static void apply(ReliabilitySnapshot snapshot, ReliabilityAssessment assessment) {
        CompositeResult result = assessment.result();
        snapshot.setScore(result.score());
        snapshot.setBand(result.band());
        snapshot.setComponents(result.components());
        snapshot.setUncertainty(result.uncertainty());
        snapshot.setReasons(new ArrayList<>(result.reasons()));
        snapshot.setReferenceImpactMetric(assessment.referenceImpactMetric());
        snapshot.setVersion(assessment.version());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(SnapshotKey key) {
        return snapshotRepository.countByKey(key.sourceId(), key.domain(), key.useCase(), key.date()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public TopKResult findTopK(String domain, UseCase useCase, LocalDate date, int limit) {
        String domainKey = domain.trim().toLowerCase(Locale.ROOT);
        PageRequest page = PageRequest.of(0, limit);

        List<ReliabilitySnapshot> rows = snapshotRepository.findRanked(domainKey, useCase, date, page);
        if (!rows.isEmpty()) {
            return new TopKResult(date, date, rows);
        }

        LocalDate latest = snapshotRepository.findLatestDateOnOrBefore(domainKey, useCase, date)
                .orElseThrow(() -> NotFoundException.noSnapshots(domainKey, useCase));
        rows = snapshotRepository.findRanked(domainKey, useCase, latest, page);
        if (rows.isEmpty()) {
            throw NotFoundException.noSnapshots(domainKey, useCase);
        }
        log.info("No snapshots for {} / {} on {}, serving {}", domainKey, useCase.getValue(), date, latest);
        return new TopKResult(date, latest, rows);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DomainAggregate> compareDomains(UseCase useCase, LocalDate date) {
        List<DomainAggregate> aggregates = new ArrayList<>();
        for (String domain : snapshotRepository.findDistinctDomains(useCase)) {
            Optional<LocalDate> resolved = snapshotRepository.findLatestDateOnOrBefore(domain, useCase, date);
            if (resolved.isEmpty()) {
                continue;
            }
            LocalDate served = resolved.get();
            ReliabilitySnapshotRepository.SnapshotStats stats = snapshotRepository.aggregate(domain, useCase, served);
            if (stats == null || stats.getSourceCount() == null || stats.getSourceCount() == 0) {
                continue;
            }
            List<ReliabilitySnapshot> top = snapshotRepository.findRanked(domain, useCase, served, PageRequest.of(0, 1));
            String topSource = top.isEmpty() ? "Unknown" : top.get(0).getSource().getName();
            aggregates.add(new DomainAggregate(
                    domain,
                    served,
                    stats.getSourceCount(),
                    round3(stats.getAvgScore()),
                    topSource,
                    round3(stats.getTopScore())));
        }
        aggregates.sort(Comparator.comparingDouble(DomainAggregate::avgScore).reversed()
                .thenComparing(DomainAggregate::domain));
        return aggregates;
    }

    private Object lockFor(SnapshotKey key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private static double round3(Double value) {
        return value == null ? 0.0 : Math.round(value * 1000.0) / 1000.0;
    }

    private static UpsertMode resolveMode(UpsertMode configured, DataSource dataSource) {
        if (configured != UpsertMode.AUTO) {
            return configured;
        }
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            log.info("Detected database product: {}", product);
            return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql")
                    ? UpsertMode.ATOMIC
                    : UpsertMode.READ_MODIFY_WRITE;
        } catch (MetaDataAccessException e) {
            log.warn("Could not detect database product, using read-modify-write upserts: {}", e.getMessage());
            return UpsertMode.READ_MODIFY_WRITE;
        }
    }
}
