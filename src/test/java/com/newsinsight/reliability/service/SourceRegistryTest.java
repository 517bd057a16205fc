package com.newsinsight.reliability.service;

import com.newsinsight.reliability.cache.TimeAwareCache;
import com.newsinsight.reliability.entity.Source;
import com.newsinsight.reliability.exception.ValidationException;
import com.newsinsight.reliability.repository.SourceRepository;
import com.newsinsight.reliability.scoring.ScoringFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.concurrent.ConcurrentMapCache;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceRegistryTest {

    @Mock
    private SourceRepository sourceRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SourceRegistry registry;

    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        TimeAwareCache<SourceRef> cache = new TimeAwareCache<>(
                new ConcurrentMapCache("sourceLookups"), Duration.ofHours(1), ScoringFixtures.FIXED_CLOCK);
        registry = new SourceRegistry(sourceRepository,
                new ImpactMetricEstimator(ScoringFixtures.scoringProperties()), cache, transactionManager);
    }

    private void saveAssignsIds() {
        when(sourceRepository.saveAndFlush(any(Source.class))).thenAnswer(invocation -> {
            Source source = invocation.getArgument(0);
            source.setId(ids.incrementAndGet());
            return source;
        });
    }

    @Test
    @DisplayName("Unknown source is registered with an estimated impact metric")
    void registersWithEstimate() {
        // given
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc("Nature")).thenReturn(Optional.empty());
        saveAssignsIds();

        // when
        SourceRef ref = registry.lookupOrCreate("  Nature ");

        // then
        ArgumentCaptor<Source> saved = ArgumentCaptor.forClass(Source.class);
        verify(sourceRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getCategory()).isEqualTo(SourceRegistry.ESTIMATED_CATEGORY);
        assertThat(ref.id()).isEqualTo(101L);
        assertThat(ref.name()).isEqualTo("Nature");
        assertThat(ref.referenceImpactMetric()).isEqualTo(45.0);
        assertThat(ref.impactMetricEstimated()).isTrue();
    }

    @Test
    @DisplayName("Supplied impact metric is stored as known")
    void registersWithSuppliedMetric() {
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc("Blood")).thenReturn(Optional.empty());
        saveAssignsIds();

        SourceRef ref = registry.lookupOrCreate("Blood", 21.0);

        assertThat(ref.referenceImpactMetric()).isEqualTo(21.0);
        assertThat(ref.impactMetricEstimated()).isFalse();
    }

    @Test
    @DisplayName("Existing source with a metric is returned untouched")
    void existingSource() {
        Source existing = Source.builder().id(7L).name("The Lancet").referenceImpactMetric(98.4).build();
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc("the lancet")).thenReturn(Optional.of(existing));

        SourceRef ref = registry.lookupOrCreate("the lancet");

        assertThat(ref.id()).isEqualTo(7L);
        assertThat(ref.name()).isEqualTo("The Lancet");
        verify(sourceRepository, never()).save(any());
        verify(sourceRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Existing source without a metric gets one filled in")
    void fillsMissingMetric() {
        Source existing = Source.builder().id(8L).name("Cancer Research").category("Oncology").build();
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc("Cancer Research")).thenReturn(Optional.of(existing));
        when(sourceRepository.save(existing)).thenReturn(existing);

        SourceRef ref = registry.lookupOrCreate("Cancer Research");

        assertThat(ref.referenceImpactMetric()).isEqualTo(15.0);
        assertThat(ref.impactMetricEstimated()).isTrue();
        assertThat(existing.getCategory()).isEqualTo("Oncology");
    }

    @Test
    @DisplayName("Repeated lookups within the expiry hit the cache")
    void cachedLookups() {
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        saveAssignsIds();

        SourceRef first = registry.lookupOrCreate("Chest");
        SourceRef second = registry.lookupOrCreate("CHEST");

        assertThat(second).isEqualTo(first);
        verify(sourceRepository, times(1)).saveAndFlush(any());
    }

    @Test
    @DisplayName("Concurrent registration is resolved by reading the winner back")
    void concurrentRegistration() {
        Source winner = Source.builder().id(55L).name("Diabetes Care").referenceImpactMetric(16.2).build();
        when(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc("Diabetes Care"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(sourceRepository.saveAndFlush(any(Source.class)))
                .thenThrow(new DataIntegrityViolationException("uq_sources_name"));

        SourceRef ref = registry.lookupOrCreate("Diabetes Care");

        assertThat(ref.id()).isEqualTo(55L);
    }

    @Test
    @DisplayName("Blank names are rejected")
    void blankName() {
        assertThatThrownBy(() -> registry.lookupOrCreate("  "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("source_name is required");
    }
}
