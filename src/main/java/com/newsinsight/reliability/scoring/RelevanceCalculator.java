package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Topical alignment of a source with a domain.
 *
 * With evidence: share of the source's estimated output that falls in the domain, plus keyword
 * overlap of sampled titles and abstracts. Without evidence: a name-based estimate from the
 * specialization factor.
 */
@Component
public class RelevanceCalculator implements ComponentCalculator {

    private final ScoringProperties.Relevance config;
    private final DomainSpecialization specialization;

    public RelevanceCalculator(ScoringProperties properties, DomainSpecialization specialization) {
        this.config = properties.getRelevance();
        this.specialization = specialization;
    }

    @Override
    public ScoreComponent component() {
        return ScoreComponent.RELEVANCE;
    }

    @Override
    public ComponentScore calculate(String sourceName, String domain, List<EvidenceItem> evidence) {
        Map<String, Object> detail = new LinkedHashMap<>();

        if (evidence == null || evidence.isEmpty()) {
            DomainSpecialization.SpecializationFactor factor = specialization.evaluate(sourceName, domain);
            double estimate = estimateFromName(factor.factor());
            detail.put("method", "name_estimate");
            detail.put("specialization_factor", factor.factor());
            detail.put("specialization_kind", factor.kind());
            return new ComponentScore(estimate, detail);
        }

        int count = evidence.size();
        int estimatedTotal = Math.max(count * config.getTotalOutputMultiplier(), config.getTotalOutputFloor());
        double domainShare = (double) count / estimatedTotal;
        ContentOverlap overlap = contentOverlap(evidence, domain);

        double score = ScoreMath.clamp01(domainShare * config.getShareWeight() + overlap.score() * config.getContentWeight());

        detail.put("method", "evidence");
        detail.put("evidence_count", count);
        detail.put("estimated_total_output", estimatedTotal);
        detail.put("domain_share", domainShare);
        detail.put("content_score", overlap.score());
        detail.put("sampled_abstracts", overlap.samples());
        detail.put("keyword_set", overlap.keywordSetFound());
        return new ComponentScore(score, detail);
    }

    private double estimateFromName(double factor) {
        if (factor > 1.2) {
            return config.getSpecializedEstimate();
        }
        if (factor > 1.0) {
            return config.getPartlySpecializedEstimate();
        }
        if (factor < 1.0) {
            return config.getBroadEstimate();
        }
        return config.getNeutralEstimate();
    }

    /**
     * Average fraction of domain keywords present in title + abstract, over up to
     * {@code sampleSize} items that carry an abstract.
     */
    ContentOverlap contentOverlap(List<EvidenceItem> evidence, String domain) {
        List<String> keywords = config.getKeywords().get(NamePatterns.normalize(domain));
        if (keywords == null || keywords.isEmpty()) {
            return new ContentOverlap(config.getNeutralContentScore(), 0, false);
        }

        double total = 0.0;
        int samples = 0;
        for (EvidenceItem item : evidence.subList(0, Math.min(config.getSampleSize(), evidence.size()))) {
            if (item.getAbstractText() == null || item.getAbstractText().isBlank()) {
                continue;
            }
            String title = item.getTitle() == null ? "" : item.getTitle();
            String text = (title + " " + item.getAbstractText()).toLowerCase(Locale.ROOT);
            long matches = keywords.stream()
                    .filter(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)))
                    .count();
            total += (double) matches / keywords.size();
            samples++;
        }

        if (samples == 0) {
            return new ContentOverlap(config.getNeutralContentScore(), 0, true);
        }
        return new ContentOverlap(total / samples, samples, true);
    }

    record ContentOverlap(double score, int samples, boolean keywordSetFound) {
    }
}
