package com.newsinsight.reliability.scoring;

/**
 * The five reliability dimensions, each in [0, 1].
 */
public record ScoreComponents(
        double authority,
        double relevance,
        double freshness,
        double guideline,
        double rigor
) {
    public ScoreComponents {
        requireUnit("authority", authority);
        requireUnit("relevance", relevance);
        requireUnit("freshness", freshness);
        requireUnit("guideline", guideline);
        requireUnit("rigor", rigor);
    }

    public double get(ScoreComponent component) {
        return switch (component) {
            case AUTHORITY -> authority;
            case RELEVANCE -> relevance;
            case FRESHNESS -> freshness;
            case GUIDELINE -> guideline;
            case RIGOR -> rigor;
        };
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
