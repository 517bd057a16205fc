package com.newsinsight.reliability.store;

import com.newsinsight.reliability.entity.UseCase;
import com.newsinsight.reliability.scoring.ReliabilityAssessment;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence of composite results, one row per (source, domain, use case, date).
 *
 * {@link #upsert} leaves at most one row per key regardless of concurrent callers; when two
 * writers race on the same key the last write wins.
 */
public interface SnapshotStore {

    void upsert(SnapshotKey key, ReliabilityAssessment assessment);

    boolean exists(SnapshotKey key);

    /**
     * Best rows for the exact date or, when that date is empty, for the latest earlier date.
     *
     * @throws com.newsinsight.reliability.exception.NotFoundException if no date on or before
     *         {@code date} has rows for the domain and use case
     */
    TopKResult findTopK(String domain, UseCase useCase, LocalDate date, int limit);

    /**
     * One aggregate per domain scored for the use case, each resolved to its latest date on or
     * before {@code date}; ordered by average score, best first.
     */
    List<DomainAggregate> compareDomains(UseCase useCase, LocalDate date);

    UpsertMode getEffectiveMode();
}
