package com.newsinsight.reliability.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans of the reliability engine.
 */
@Configuration
@EnableConfigurationProperties({ScoringProperties.class, ReliabilityProperties.class})
public class ReliabilityConfig {

    /**
     * "Today" for the worker and "current year" for freshness.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
