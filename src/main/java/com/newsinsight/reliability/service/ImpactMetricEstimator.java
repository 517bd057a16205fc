package com.newsinsight.reliability.service;

import com.newsinsight.reliability.config.ScoringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Estimates a legacy impact metric for venues that arrive without one.
 *
 * The name is normalized (lowercased, whitespace collapsed, generic "journal"/"review" affixes
 * removed) and matched against ordered regex tiers from {@code reliability.scoring.impact-estimate}.
 * The estimate is reference data only and never feeds the composite score.
 */
@Component
@Slf4j
public class ImpactMetricEstimator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern GENERIC_SUFFIX = Pattern.compile("\\s*(journal|magazine|review|letters?|proceedings)\\s*$");
    private static final Pattern GENERIC_PREFIX = Pattern.compile("^(the|journal of|international journal of)\\s*");

    private final List<CompiledTier> tiers;
    private final double defaultScore;

    public ImpactMetricEstimator(ScoringProperties properties) {
        ScoringProperties.ImpactEstimate config = properties.getImpactEstimate();
        this.tiers = new ArrayList<>();
        for (ScoringProperties.Tier tier : config.getTiers()) {
            List<Pattern> patterns = tier.getPatterns().stream().map(Pattern::compile).toList();
            tiers.add(new CompiledTier(tier.getScore(), patterns));
        }
        this.defaultScore = config.getDefaultScore();
    }

    public double estimate(String sourceName) {
        String text = normalizeName(sourceName);
        for (CompiledTier tier : tiers) {
            for (Pattern pattern : tier.patterns()) {
                if (pattern.matcher(text).find()) {
                    log.debug("Estimated impact metric for '{}': {} (pattern '{}')", sourceName, tier.score(), pattern);
                    return tier.score();
                }
            }
        }
        return defaultScore;
    }

    static String normalizeName(String sourceName) {
        if (sourceName == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(sourceName.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        normalized = GENERIC_SUFFIX.matcher(normalized).replaceAll("");
        normalized = GENERIC_PREFIX.matcher(normalized).replaceAll("");
        return normalized;
    }

    /**
     * Human-readable reliability tier for a legacy impact metric.
     */
    public static String tierLabel(Double impactMetric) {
        if (impactMetric == null) {
            return null;
        }
        if (impactMetric >= 50) {
            return "Tier 1: Highest reliability";
        } else if (impactMetric >= 10) {
            return "Tier 2: High reliability";
        } else if (impactMetric >= 5) {
            return "Tier 3: Good reliability";
        } else if (impactMetric >= 2) {
            return "Tier 4: Standard reliability";
        }
        return "Tier 5: Lower reliability";
    }

    private record CompiledTier(double score, List<Pattern> patterns) {
    }
}
