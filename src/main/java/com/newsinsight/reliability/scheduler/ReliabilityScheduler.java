package com.newsinsight.reliability.scheduler;

import com.newsinsight.reliability.config.ReliabilityProperties;
import com.newsinsight.reliability.worker.ReliabilityWorker;
import com.newsinsight.reliability.worker.WorkerReport;
import com.newsinsight.reliability.worker.WorkerRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly snapshot computation.
 * Runs at 02:00 by default; adjust with {@code reliability.worker.scheduling.cron}.
 */
@Component
@ConditionalOnProperty(name = "reliability.worker.cli.enabled", havingValue = "false", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReliabilityScheduler {

    private final ReliabilityWorker worker;
    private final ReliabilityProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${reliability.worker.scheduling.cron:0 0 2 * * *}")
    public void scheduledComputation() {
        ReliabilityProperties.Scheduling scheduling = properties.getWorker().getScheduling();
        if (!scheduling.isEnabled()) {
            log.debug("Scheduled reliability computation is disabled");
            return;
        }

        if (scheduling.isSkipIfRunning() && worker.isRunning()) {
            log.info("Skipping scheduled reliability computation: a run is already in progress");
            return;
        }

        LocalDate today = LocalDate.now(clock);
        log.info("Starting scheduled reliability computation for {}", today);
        try {
            WorkerReport report = worker.run(WorkerRequest.forDate(today));
            log.info("Scheduled reliability computation finished: computed={}, skipped={}, errored={}",
                    report.computed(), report.skipped(), report.errored());
        } catch (Exception e) {
            log.error("Scheduled reliability computation failed: {}", e.getMessage(), e);
        }
    }
}
