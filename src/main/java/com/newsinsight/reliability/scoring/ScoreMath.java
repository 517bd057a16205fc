package com.newsinsight.reliability.scoring;

final class ScoreMath {

    private ScoreMath() {
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Round half-up to three decimals.
     */
    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
