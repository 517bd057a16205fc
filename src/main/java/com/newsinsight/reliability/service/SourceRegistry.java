package com.newsinsight.reliability.service;

import com.newsinsight.reliability.cache.TimeAwareCache;
import com.newsinsight.reliability.entity.Source;
import com.newsinsight.reliability.exception.ValidationException;
import com.newsinsight.reliability.repository.SourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Lookup-or-create of rated sources by name.
 *
 * Sources referenced only by evidence are registered on first use with an estimated impact
 * metric. Registration commits on its own so a cached id always points at a stored row.
 */
@Service
@Slf4j
public class SourceRegistry {

    static final String ESTIMATED_CATEGORY = "Estimated";

    private final SourceRepository sourceRepository;
    private final ImpactMetricEstimator estimator;
    private final TimeAwareCache<SourceRef> sourceLookupCache;
    private final TransactionTemplate requiresNew;

    public SourceRegistry(SourceRepository sourceRepository,
                          ImpactMetricEstimator estimator,
                          TimeAwareCache<SourceRef> sourceLookupCache,
                          PlatformTransactionManager transactionManager) {
        this.sourceRepository = sourceRepository;
        this.estimator = estimator;
        this.sourceLookupCache = sourceLookupCache;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public SourceRef lookupOrCreate(String name) {
        return lookupOrCreate(name, null);
    }

    /**
     * @param referenceImpactMetric known metric for a new source; estimated from the name when null
     */
    public SourceRef lookupOrCreate(String name, Double referenceImpactMetric) {
        if (name == null || name.isBlank()) {
            throw ValidationException.required("source_name");
        }
        String canonical = name.trim();
        return sourceLookupCache.get(canonical, () -> resolve(canonical, referenceImpactMetric));
    }

    public void evict(String name) {
        sourceLookupCache.evict(name);
    }

    private SourceRef resolve(String name, Double referenceImpactMetric) {
        try {
            return requiresNew.execute(status -> findOrCreate(name, referenceImpactMetric));
        } catch (DataIntegrityViolationException e) {
            log.debug("Source '{}' was registered concurrently, reading it back", name);
            return requiresNew.execute(status -> findOrCreate(name, referenceImpactMetric));
        }
    }

    private SourceRef findOrCreate(String name, Double referenceImpactMetric) {
        Optional<Source> existing = sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc(name);
        if (existing.isPresent()) {
            Source source = existing.get();
            if (source.getReferenceImpactMetric() == null) {
                fillImpactMetric(source, referenceImpactMetric);
                source = sourceRepository.save(source);
                log.info("Filled in impact metric for '{}': {} (estimated={})",
                        source.getName(), source.getReferenceImpactMetric(), source.getImpactMetricEstimated());
            }
            return SourceRef.of(source);
        }

        Source source = Source.builder().name(name).build();
        fillImpactMetric(source, referenceImpactMetric);
        source = sourceRepository.saveAndFlush(source);
        log.info("Registered source '{}' with impact metric {} (estimated={})",
                name, source.getReferenceImpactMetric(), source.getImpactMetricEstimated());
        return SourceRef.of(source);
    }

    private void fillImpactMetric(Source source, Double referenceImpactMetric) {
        if (referenceImpactMetric != null) {
            source.setReferenceImpactMetric(referenceImpactMetric);
            source.setImpactMetricEstimated(false);
            return;
        }
        source.setReferenceImpactMetric(estimator.estimate(source.getName()));
        source.setImpactMetricEstimated(true);
        if (source.getCategory() == null) {
            source.setCategory(ESTIMATED_CATEGORY);
        }
    }
}
