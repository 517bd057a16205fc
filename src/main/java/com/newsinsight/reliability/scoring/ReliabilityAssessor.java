package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import com.newsinsight.reliability.entity.UseCase;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the five calculators over one (source, domain) evidence set and feeds the composite scorer.
 * Deterministic for identical inputs; only {@code computedAt} varies.
 */
@Service
public class ReliabilityAssessor {

    private final Map<ScoreComponent, ComponentCalculator> calculators;
    private final CompositeScorer compositeScorer;
    private final String version;
    private final Clock clock;

    public ReliabilityAssessor(List<ComponentCalculator> calculators, CompositeScorer compositeScorer,
                               ScoringProperties properties, Clock clock) {
        this.calculators = new EnumMap<>(ScoreComponent.class);
        for (ComponentCalculator calculator : calculators) {
            this.calculators.put(calculator.component(), calculator);
        }
        for (ScoreComponent component : ScoreComponent.values()) {
            if (!this.calculators.containsKey(component)) {
                throw new IllegalStateException("No calculator registered for " + component.getValue());
            }
        }
        this.compositeScorer = compositeScorer;
        this.version = properties.getVersion();
        this.clock = clock;
    }

    public ReliabilityAssessment assess(String sourceName, String domain, UseCase useCase,
                                        List<EvidenceItem> evidence, Double referenceImpactMetric) {
        List<EvidenceItem> items = evidence == null ? List.of() : evidence;
        String domainKey = domain.trim().toLowerCase(Locale.ROOT);

        Map<ScoreComponent, ComponentScore> scores = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            scores.put(component, calculators.get(component).calculate(sourceName, domainKey, items));
        }

        ScoreComponents components = new ScoreComponents(
                scores.get(ScoreComponent.AUTHORITY).score(),
                scores.get(ScoreComponent.RELEVANCE).score(),
                scores.get(ScoreComponent.FRESHNESS).score(),
                scores.get(ScoreComponent.GUIDELINE).score(),
                scores.get(ScoreComponent.RIGOR).score());

        CompositeResult result = compositeScorer.combine(components, useCase, items.size());

        Map<ScoreComponent, Map<String, Object>> details = new EnumMap<>(ScoreComponent.class);
        scores.forEach((component, score) -> details.put(component, score.detail()));

        return new ReliabilityAssessment(sourceName, domainKey, useCase, result, details,
                items.size(), referenceImpactMetric, version, Instant.now(clock));
    }
}
