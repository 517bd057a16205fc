package com.newsinsight.reliability.config;

import com.newsinsight.reliability.store.UpsertMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for the worker, snapshot store, cache and query surface.
 */
@ConfigurationProperties(prefix = "reliability")
@Data
public class ReliabilityProperties {

    private Worker worker = new Worker();

    private Store store = new Store();

    private Cache cache = new Cache();

    private Query query = new Query();

    @Data
    public static class Worker {
        /** Domains processed when the evidence repository exposes none. */
        private List<String> defaultDomains = new ArrayList<>(List.of(
                "oncology", "cardiovascular", "neurology", "immunology",
                "endocrinology", "respiratory", "gastroenterology"));

        private Scheduling scheduling = new Scheduling();

        private Cli cli = new Cli();
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
        private boolean skipIfRunning = true;
    }

    @Data
    public static class Cli {
        /** Run the worker once from the command line and exit. */
        private boolean enabled = false;
    }

    @Data
    public static class Store {
        private UpsertMode upsertMode = UpsertMode.AUTO;

        /** Attempts for a read-modify-write upsert that lost a race. */
        private int conflictMaxAttempts = 3;
    }

    @Data
    public static class Cache {
        /** caffeine | redis */
        private String store = "caffeine";
        private Duration sourceLookupTtl = Duration.ofHours(1);
        private long localMaxSize = 5000;
    }

    @Data
    public static class Query {
        private int defaultLimit = 25;
        private int maxLimit = 100;
        private int maxRefreshDomains = 10;
    }
}
