package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties.Tier;

import java.util.List;
import java.util.Locale;

/**
 * Substring matching of source names against configured tier tables.
 */
public final class NamePatterns {

    private NamePatterns() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * First pattern contained in the text, or null.
     */
    public static String firstContained(String lowerText, List<String> patterns) {
        if (patterns == null) {
            return null;
        }
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isEmpty() && lowerText.contains(pattern.toLowerCase(Locale.ROOT))) {
                return pattern;
            }
        }
        return null;
    }

    public static boolean containsAny(String lowerText, List<String> patterns) {
        return firstContained(lowerText, patterns) != null;
    }

    /**
     * Evaluate an ordered tier table; the first tier whose patterns match and whose excludes
     * do not wins.
     */
    public static TierMatch matchTier(String sourceName, List<Tier> tiers, double defaultScore) {
        String name = normalize(sourceName);
        if (tiers != null) {
            for (Tier tier : tiers) {
                String hit = firstContained(name, tier.getPatterns());
                if (hit != null && !containsAny(name, tier.getExcludes())) {
                    return new TierMatch(tier.getScore(), hit);
                }
            }
        }
        return new TierMatch(defaultScore, null);
    }

    /**
     * @param matchedPattern null when the default score applied
     */
    public record TierMatch(double score, String matchedPattern) {

        public boolean isDefault() {
            return matchedPattern == null;
        }
    }
}
