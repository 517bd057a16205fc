package com.newsinsight.reliability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * NewsInsight Reliability Service Application
 *
 * Domain-aware source reliability scoring
 * - Five component calculators combined per use case into a composite score
 * - Nightly snapshot computation with partial-failure tolerance
 * - Top-K rankings with date fallback served from PostgreSQL
 *
 * With {@code reliability.worker.cli.enabled=true} (profile {@code worker}) the application
 * runs the worker once and exits with the worker's exit code.
 */
@SpringBootApplication
@EnableScheduling
public class ReliabilityApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ReliabilityApplication.class, args);
        if (context.getEnvironment().getProperty("reliability.worker.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
