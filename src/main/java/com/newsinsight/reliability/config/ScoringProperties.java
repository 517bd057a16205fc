package com.newsinsight.reliability.config;

import com.newsinsight.reliability.entity.UseCase;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized scoring tables for the reliability meter.
 *
 * Name-pattern tiers, domain vocabularies and weight profiles are loaded from
 * {@code reliability.scoring.*} in application.yml, so tuning a table is a configuration change.
 * Scalar constants keep Java defaults.
 *
 * Component scores range from 0.0 to 1.0 where:
 * - 0.90+ : flagship venues with the strongest editorial standards
 * - 0.70-0.89: established specialty and clinical venues
 * - 0.50-0.69: generic venues
 * - < 0.50: thin or off-domain evidence
 */
@ConfigurationProperties(prefix = "reliability.scoring")
@Data
public class ScoringProperties {

    /** Algorithm version tag written to every snapshot. */
    private String version = "v2";

    /** Maximum evidence items fetched per (source, domain). */
    private int evidenceLimit = 100;

    private Authority authority = new Authority();

    private Specialization specialization = new Specialization();

    private Relevance relevance = new Relevance();

    private Freshness freshness = new Freshness();

    private TierTable guideline = new TierTable();

    private TierTable rigor = new TierTable();

    private Map<UseCase, Weights> weights = new LinkedHashMap<>();

    private Bands bands = new Bands();

    private Uncertainty uncertainty = new Uncertainty();

    private ImpactEstimate impactEstimate = new ImpactEstimate();

    /**
     * One row of a name-pattern table. Matches when the lowercased name contains any pattern
     * and none of the excludes.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {
        private double score;
        private List<String> patterns = new ArrayList<>();
        private List<String> excludes = new ArrayList<>();

        public Tier(double score, List<String> patterns) {
            this(score, patterns, new ArrayList<>());
        }
    }

    /**
     * Ordered tier list; the first matching tier wins, otherwise {@code defaultScore}.
     */
    @Data
    public static class TierTable {
        private List<Tier> tiers = new ArrayList<>();
        private double defaultScore = 0.5;
    }

    @Data
    public static class Authority {
        private List<Tier> tiers = new ArrayList<>();
        private double defaultScore = 0.50;

        /** Evidence volume boost = min(volumeCap, count / volumeDivisor). */
        private double volumeDivisor = 50.0;
        private double volumeCap = 0.3;

        /** Flat bonus for globally trusted venues and societies. */
        private double trustBonus = 0.08;
        private List<String> trustedEntities = new ArrayList<>();
    }

    @Data
    public static class Specialization {
        /** Domain → name vocabulary that marks a specialized venue. */
        private Map<String, List<String>> vocabulary = new LinkedHashMap<>();

        /** Name fragments of broad, general-audience venues. */
        private List<String> broadIndicators = new ArrayList<>();

        /** Domains that are themselves generic; broad venues are not penalized there. */
        private List<String> genericDomains = new ArrayList<>();

        private double boost = 1.4;
        private double penalty = 0.7;
    }

    @Data
    public static class Relevance {
        /** Domain → content keywords checked against title + abstract. */
        private Map<String, List<String>> keywords = new LinkedHashMap<>();

        /** Estimated total output = max(count * totalOutputMultiplier, totalOutputFloor). */
        private int totalOutputMultiplier = 3;
        private int totalOutputFloor = 30;
        private double shareWeight = 1.5;
        private double contentWeight = 0.5;
        private int sampleSize = 20;

        /** Content score when the domain has no keyword set or no abstract is available. */
        private double neutralContentScore = 0.5;

        /** Name-based estimates used when there is no evidence at all. */
        private double specializedEstimate = 0.8;
        private double partlySpecializedEstimate = 0.6;
        private double broadEstimate = 0.3;
        private double neutralEstimate = 0.5;
    }

    @Data
    public static class Freshness {
        /** Items published within this many years of the current year count as recent. */
        private int windowYears = 2;

        /** Number of recent items that saturates freshness at 1.0. */
        private int saturationCount = 15;

        /** Score when there is no evidence at all. */
        private double floor = 0.1;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Weights {
        private double authority;
        private double relevance;
        private double freshness;
        private double guideline;
        private double rigor;

        /**
         * Exact decimal sum of the five weights.
         */
        public BigDecimal exactSum() {
            return BigDecimal.valueOf(authority)
                    .add(BigDecimal.valueOf(relevance))
                    .add(BigDecimal.valueOf(freshness))
                    .add(BigDecimal.valueOf(guideline))
                    .add(BigDecimal.valueOf(rigor));
        }
    }

    @Data
    public static class Bands {
        private double high = 0.80;
        private double moderate = 0.60;
        private double exploratory = 0.40;
    }

    @Data
    public static class Uncertainty {
        /** Fewer evidence items than this → HIGH uncertainty. */
        private int highBelow = 3;

        /** Fewer evidence items than this → MEDIUM uncertainty. */
        private int mediumBelow = 10;
    }

    @Data
    public static class ImpactEstimate {
        /** Ordered regex tiers matched against the normalized source name. */
        private List<Tier> tiers = new ArrayList<>();
        private double defaultScore = 2.5;
    }
}
