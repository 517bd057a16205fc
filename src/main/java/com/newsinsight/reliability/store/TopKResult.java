package com.newsinsight.reliability.store;

import com.newsinsight.reliability.entity.ReliabilitySnapshot;

import java.time.LocalDate;
import java.util.List;

/**
 * Ranked snapshot rows and the date they were actually read from.
 */
public record TopKResult(LocalDate requestedDate, LocalDate servedDate, List<ReliabilitySnapshot> rows) {

    public TopKResult {
        rows = List.copyOf(rows);
    }

    public boolean isFallback() {
        return !requestedDate.equals(servedDate);
    }
}
