package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * How specialized a venue is for a domain, judged from its name.
 *
 * Specialty vocabulary in the name earns the boost (1.4 by default); broad, general-audience
 * names get the penalty (0.7) unless the domain itself is generic; everything else is neutral.
 * Shared by the authority and relevance calculators.
 */
@Component
public class DomainSpecialization {

    private final ScoringProperties.Specialization config;

    public DomainSpecialization(ScoringProperties properties) {
        this.config = properties.getSpecialization();
    }

    public SpecializationFactor evaluate(String sourceName, String domain) {
        String name = NamePatterns.normalize(sourceName);
        String domainKey = NamePatterns.normalize(domain);

        List<String> vocabulary = config.getVocabulary().get(domainKey);
        String specialtyTerm = NamePatterns.firstContained(name, vocabulary);
        if (specialtyTerm != null) {
            return new SpecializationFactor(config.getBoost(), "specialized", specialtyTerm);
        }

        String broadTerm = NamePatterns.firstContained(name, config.getBroadIndicators());
        if (broadTerm != null && !isGenericDomain(domainKey)) {
            return new SpecializationFactor(config.getPenalty(), "broad", broadTerm);
        }

        return new SpecializationFactor(1.0, "neutral", null);
    }

    private boolean isGenericDomain(String domainKey) {
        return config.getGenericDomains().stream()
                .map(NamePatterns::normalize)
                .anyMatch(domainKey::equals);
    }

    /**
     * @param kind specialized, broad or neutral
     * @param matchedTerm name fragment that decided the factor, null when neutral
     */
    public record SpecializationFactor(double factor, String kind, String matchedTerm) {
    }
}
