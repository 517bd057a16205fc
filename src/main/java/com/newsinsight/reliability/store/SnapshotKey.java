package com.newsinsight.reliability.store;

import com.newsinsight.reliability.entity.UseCase;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Composite identity of a snapshot row. Domains are stored lowercased.
 */
public record SnapshotKey(Long sourceId, String domain, UseCase useCase, LocalDate date) {

    public SnapshotKey {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(useCase, "useCase must not be null");
        Objects.requireNonNull(date, "date must not be null");
        domain = domain.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return sourceId + "|" + domain + "|" + useCase.getValue() + "|" + date;
    }
}
