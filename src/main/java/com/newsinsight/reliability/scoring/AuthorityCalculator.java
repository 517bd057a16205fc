package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain-conditioned authority.
 *
 * authority = clamp(baseTier(name) * specialization(name, domain)
 *                   + min(volumeCap, evidenceCount / volumeDivisor)
 *                   + trustBonus if the name belongs to a trusted venue or society)
 */
@Component
public class AuthorityCalculator implements ComponentCalculator {

    private final ScoringProperties.Authority config;
    private final DomainSpecialization specialization;

    public AuthorityCalculator(ScoringProperties properties, DomainSpecialization specialization) {
        this.config = properties.getAuthority();
        this.specialization = specialization;
    }

    @Override
    public ScoreComponent component() {
        return ScoreComponent.AUTHORITY;
    }

    @Override
    public ComponentScore calculate(String sourceName, String domain, List<EvidenceItem> evidence) {
        int evidenceCount = evidence == null ? 0 : evidence.size();

        NamePatterns.TierMatch base = NamePatterns.matchTier(sourceName, config.getTiers(), config.getDefaultScore());
        DomainSpecialization.SpecializationFactor factor = specialization.evaluate(sourceName, domain);
        double volumeBoost = Math.min(config.getVolumeCap(), evidenceCount / config.getVolumeDivisor());
        String trustedEntity = NamePatterns.firstContained(NamePatterns.normalize(sourceName), config.getTrustedEntities());
        double trustBonus = trustedEntity != null ? config.getTrustBonus() : 0.0;

        double score = ScoreMath.clamp01(base.score() * factor.factor() + volumeBoost + trustBonus);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("base_tier_score", base.score());
        detail.put("base_tier_pattern", base.matchedPattern());
        detail.put("specialization_factor", factor.factor());
        detail.put("specialization_kind", factor.kind());
        detail.put("specialization_term", factor.matchedTerm());
        detail.put("evidence_count", evidenceCount);
        detail.put("volume_boost", volumeBoost);
        detail.put("trust_bonus", trustBonus);
        detail.put("trusted_entity", trustedEntity);
        return new ComponentScore(score, detail);
    }
}
