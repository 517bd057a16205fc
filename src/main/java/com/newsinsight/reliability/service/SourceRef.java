package com.newsinsight.reliability.service;

import com.newsinsight.reliability.entity.Source;

import java.io.Serializable;

/**
 * Cacheable view of a registered source.
 */
public record SourceRef(Long id, String name, Double referenceImpactMetric, boolean impactMetricEstimated)
        implements Serializable {

    public static SourceRef of(Source source) {
        return new SourceRef(source.getId(), source.getName(), source.getReferenceImpactMetric(),
                Boolean.TRUE.equals(source.getImpactMetricEstimated()));
    }
}
