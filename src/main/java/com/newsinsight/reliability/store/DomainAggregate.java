package com.newsinsight.reliability.store;

import java.time.LocalDate;

/**
 * Per-domain summary over one date-resolved snapshot set.
 */
public record DomainAggregate(
        String domain,
        LocalDate snapshotDate,
        long sourceCount,
        double avgScore,
        String topSourceName,
        double topScore
) {
}
