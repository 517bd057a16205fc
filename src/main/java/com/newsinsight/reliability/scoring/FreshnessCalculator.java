package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.config.ScoringProperties;
import com.newsinsight.reliability.entity.EvidenceItem;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Recent publication activity in the domain.
 *
 * Counts items published within {@code windowYears} of the current year and saturates at
 * {@code saturationCount}. Items whose date does not start with a four-digit year are skipped.
 */
@Component
public class FreshnessCalculator implements ComponentCalculator {

    private final ScoringProperties.Freshness config;
    private final Clock clock;

    public FreshnessCalculator(ScoringProperties properties, Clock clock) {
        this.config = properties.getFreshness();
        this.clock = clock;
    }

    @Override
    public ScoreComponent component() {
        return ScoreComponent.FRESHNESS;
    }

    @Override
    public ComponentScore calculate(String sourceName, String domain, List<EvidenceItem> evidence) {
        Map<String, Object> detail = new LinkedHashMap<>();
        if (evidence == null || evidence.isEmpty()) {
            detail.put("method", "floor");
            return new ComponentScore(config.getFloor(), detail);
        }

        int currentYear = LocalDate.now(clock).getYear();
        int recent = 0;
        int undated = 0;
        for (EvidenceItem item : evidence) {
            OptionalInt year = publicationYear(item.getPublicationDate());
            if (year.isEmpty()) {
                undated++;
                continue;
            }
            if (currentYear - year.getAsInt() <= config.getWindowYears()) {
                recent++;
            }
        }

        double score = Math.min(1.0, (double) recent / config.getSaturationCount());

        detail.put("method", "recent_count");
        detail.put("current_year", currentYear);
        detail.put("recent_count", recent);
        detail.put("undated_count", undated);
        detail.put("saturation_count", config.getSaturationCount());
        return new ComponentScore(score, detail);
    }

    static OptionalInt publicationYear(String publicationDate) {
        if (publicationDate == null || publicationDate.length() < 4) {
            return OptionalInt.empty();
        }
        String prefix = publicationDate.substring(0, 4);
        for (int i = 0; i < prefix.length(); i++) {
            if (!Character.isDigit(prefix.charAt(i))) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of(Integer.parseInt(prefix));
    }
}
