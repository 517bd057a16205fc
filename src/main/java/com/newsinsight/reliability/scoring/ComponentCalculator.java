package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.entity.EvidenceItem;

import java.util.List;

/**
 * Pure function of (source name, domain, evidence) plus fixed configuration tables.
 * Implementations hold no mutable state.
 */
public interface ComponentCalculator {

    ScoreComponent component();

    ComponentScore calculate(String sourceName, String domain, List<EvidenceItem> evidence);
}
