package com.newsinsight.reliability.worker;

import com.newsinsight.reliability.entity.UseCase;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parameters of one worker run.
 *
 * @param targetDate snapshot date to compute; today when null
 * @param domains    explicit domain filter; discovered from evidence when empty
 * @param useCases   use cases to score; both when empty
 * @param force      recompute keys that already have a snapshot for the date
 */
public record WorkerRequest(LocalDate targetDate, List<String> domains, Set<UseCase> useCases, boolean force) {

    public WorkerRequest {
        domains = domains == null ? List.of() : List.copyOf(domains);
        useCases = useCases == null || useCases.isEmpty()
                ? Set.copyOf(EnumSet.allOf(UseCase.class))
                : Set.copyOf(useCases);
    }

    public static WorkerRequest forDate(LocalDate targetDate) {
        return new WorkerRequest(targetDate, List.of(), Set.of(), false);
    }
}
