package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;
import com.newsinsight.reliability.entity.UseCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the five components under a use-case weight profile.
 *
 * composite = round3(Σ weight_i × component_i); the band is taken from the rounded score,
 * uncertainty from the evidence count.
 */
@Component
@Slf4j
public class CompositeScorer {

    static final int MAX_REASONS = 4;

    private final Map<UseCase, ScoringProperties.Weights> weights;
    private final ScoringProperties.Bands bands;
    private final ScoringProperties.Uncertainty uncertaintyThresholds;

    public CompositeScorer(ScoringProperties properties) {
        this.weights = validatedWeights(properties.getWeights());
        this.bands = properties.getBands();
        this.uncertaintyThresholds = properties.getUncertainty();
    }

    public CompositeResult combine(ScoreComponents components, UseCase useCase, int evidenceCount) {
        ScoringProperties.Weights w = weightsFor(useCase);
        double raw = w.getAuthority() * components.authority()
                + w.getRelevance() * components.relevance()
                + w.getFreshness() * components.freshness()
                + w.getGuideline() * components.guideline()
                + w.getRigor() * components.rigor();
        double score = ScoreMath.clamp01(ScoreMath.round3(raw));

        ReliabilityBand band = band(score);
        UncertaintyLevel uncertainty = uncertainty(evidenceCount);
        List<String> reasons = explain(components, band, uncertainty, useCase);
        return new CompositeResult(score, band, components, uncertainty, reasons);
    }

    public ScoringProperties.Weights weightsFor(UseCase useCase) {
        ScoringProperties.Weights w = weights.get(useCase);
        if (w == null) {
            throw new IllegalArgumentException("No weight profile for use case " + useCase);
        }
        return w;
    }

    public ReliabilityBand band(double score) {
        if (score >= bands.getHigh()) {
            return ReliabilityBand.HIGH;
        }
        if (score >= bands.getModerate()) {
            return ReliabilityBand.MODERATE;
        }
        if (score >= bands.getExploratory()) {
            return ReliabilityBand.EXPLORATORY;
        }
        return ReliabilityBand.LOW;
    }

    public UncertaintyLevel uncertainty(int evidenceCount) {
        if (evidenceCount < uncertaintyThresholds.getHighBelow()) {
            return UncertaintyLevel.HIGH;
        }
        if (evidenceCount < uncertaintyThresholds.getMediumBelow()) {
            return UncertaintyLevel.MEDIUM;
        }
        return UncertaintyLevel.LOW;
    }

    /**
     * Band summary first, then component reasons, then the evidence caveat; at most four.
     */
    List<String> explain(ScoreComponents components, ReliabilityBand band,
                         UncertaintyLevel uncertainty, UseCase useCase) {
        List<String> reasons = new ArrayList<>();

        switch (band) {
            case HIGH -> reasons.add("Highly reliable source for " + useCase.getValue() + " use");
            case MODERATE -> reasons.add("Good reliability for " + useCase.getValue() + " use");
            case EXPLORATORY -> reasons.add("Moderate reliability - suitable for " + useCase.getValue() + " research");
            case LOW -> reasons.add("Lower reliability - consider supplementary sources");
        }

        if (components.authority() >= 0.8) {
            reasons.add("High authority in this domain");
        } else if (components.authority() >= 0.6) {
            reasons.add("Moderate authority in this domain");
        }

        if (components.relevance() >= 0.8) {
            reasons.add("Highly specialized for this domain");
        } else if (components.relevance() >= 0.6) {
            reasons.add("Good specialization for this domain");
        }

        if (components.freshness() >= 0.7) {
            reasons.add("Active recent publication in this domain");
        }

        if (components.guideline() >= 0.8) {
            reasons.add("Frequently cited in clinical guidelines");
        }

        if (uncertainty == UncertaintyLevel.HIGH) {
            reasons.add("Limited evidence available - interpret cautiously");
        }

        return reasons.size() > MAX_REASONS ? reasons.subList(0, MAX_REASONS) : reasons;
    }

    private static Map<UseCase, ScoringProperties.Weights> validatedWeights(Map<UseCase, ScoringProperties.Weights> configured) {
        Map<UseCase, ScoringProperties.Weights> result = new EnumMap<>(UseCase.class);
        for (UseCase useCase : UseCase.values()) {
            ScoringProperties.Weights w = configured == null ? null : configured.get(useCase);
            if (w == null) {
                throw new IllegalStateException("Missing weight profile for use case '" + useCase.getValue() + "'");
            }
            for (double value : new double[] {w.getAuthority(), w.getRelevance(), w.getFreshness(), w.getGuideline(), w.getRigor()}) {
                if (value < 0.0 || value > 1.0) {
                    throw new IllegalStateException("Weights for '" + useCase.getValue() + "' must be within [0, 1]: " + w);
                }
            }
            if (w.exactSum().compareTo(BigDecimal.ONE) != 0) {
                throw new IllegalStateException("Weights for '" + useCase.getValue() + "' must sum to 1.0, got " + w.exactSum());
            }
            result.put(useCase, w);
        }
        log.info("Loaded weight profiles: {}", result);
        return result;
    }
}
