package com.newsinsight.reliability.exception;

import com.newsinsight.reliability.worker.WorkerReport;

import java.util.List;

/**
 * Fatal worker failure: storage could not be opened or a domain batch could not be committed.
 * Domains committed before the failure stay valid.
 */
public class WorkerAbortedException extends ReliabilityException {

    private final List<String> unprocessedDomains;
    private final WorkerReport partialReport;

    public WorkerAbortedException(String message, List<String> unprocessedDomains,
                                  WorkerReport partialReport, Throwable cause) {
        super("WORKER_ABORTED", message, cause);
        this.unprocessedDomains = List.copyOf(unprocessedDomains);
        this.partialReport = partialReport;
    }

    public List<String> getUnprocessedDomains() {
        return unprocessedDomains;
    }

    public WorkerReport getPartialReport() {
        return partialReport;
    }
}
