package com.newsinsight.reliability.scoring;

/**
 * Identifies one of the five component calculators.
 */
public enum ScoreComponent {
    AUTHORITY("authority"),
    RELEVANCE("relevance"),
    FRESHNESS("freshness"),
    GUIDELINE("guideline"),
    RIGOR("rigor");

    private final String value;

    ScoreComponent(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
