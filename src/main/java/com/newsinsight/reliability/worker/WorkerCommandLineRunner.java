package com.newsinsight.reliability.worker;

import com.newsinsight.reliability.exception.WorkerAbortedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/**
 * One-shot worker run from the command line.
 *
 * <pre>
 *   --date=2024-01-15   snapshot date (default: today)
 *   --domain=oncology   restrict to a domain, repeatable
 *   --force             recompute existing snapshots
 * </pre>
 *
 * Exit code 0 when the run completes (item errors included), 1 on a fatal failure,
 * 2 on an unparseable date.
 */
@Component
@ConditionalOnProperty(name = "reliability.worker.cli.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class WorkerCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_INVALID_DATE = 2;

    private final ReliabilityWorker worker;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        LocalDate targetDate = null;
        List<String> dateValues = args.getOptionValues("date");
        if (dateValues != null && !dateValues.isEmpty()) {
            try {
                targetDate = LocalDate.parse(dateValues.get(0).trim());
            } catch (DateTimeParseException e) {
                log.error("Invalid date format: {}. Use YYYY-MM-DD format.", dateValues.get(0));
                exitCode = EXIT_INVALID_DATE;
                return;
            }
        }

        List<String> domains = args.getOptionValues("domain");
        boolean force = args.containsOption("force");
        WorkerRequest request = new WorkerRequest(targetDate, domains, Set.of(), force);

        try {
            WorkerReport report = worker.run(request);
            log.info("Worker finished: computed={}, skipped={}, errored={}, interrupted={}",
                    report.computed(), report.skipped(), report.errored(), report.interrupted());
            exitCode = EXIT_OK;
        } catch (WorkerAbortedException e) {
            log.error("Worker aborted, unprocessed domains: {}", e.getUnprocessedDomains());
            exitCode = EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Worker failed: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
