package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Editorial rigor proxy. Same tier shape as authority, different constants.
 */
@Component
public class RigorCalculator implements ComponentCalculator {

    private final ScoringProperties.TierTable config;

    public RigorCalculator(ScoringProperties properties) {
        this.config = properties.getRigor();
    }

    @Override
    public ScoreComponent component() {
        return ScoreComponent.RIGOR;
    }

    @Override
    public ComponentScore calculate(String sourceName, String domain, List<EvidenceItem> evidence) {
        NamePatterns.TierMatch match = NamePatterns.matchTier(sourceName, config.getTiers(), config.getDefaultScore());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("method", "name_heuristic");
        detail.put("matched_pattern", match.matchedPattern());
        return new ComponentScore(ScoreMath.clamp01(match.score()), detail);
    }
}
