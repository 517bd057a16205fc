package com.newsinsight.reliability.worker;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a worker run. Counts cover committed domains only.
 */
public record WorkerReport(
        LocalDate targetDate,
        int computed,
        int skipped,
        int errored,
        List<String> processedDomains,
        List<String> unprocessedDomains,
        boolean interrupted,
        Instant startedAt,
        Instant completedAt
) {
    public WorkerReport {
        processedDomains = List.copyOf(processedDomains);
        unprocessedDomains = List.copyOf(unprocessedDomains);
    }
}
