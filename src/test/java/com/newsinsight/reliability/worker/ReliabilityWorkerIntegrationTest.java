package com.newsinsight.reliability.worker;

import com.newsinsight.reliability.entity.EvidenceItem;
import com.newsinsight.reliability.entity.ReliabilitySnapshot;
import com.newsinsight.reliability.entity.Source;
import com.newsinsight.reliability.repository.EvidenceItemRepository;
import com.newsinsight.reliability.repository.ReliabilitySnapshotRepository;
import com.newsinsight.reliability.repository.SourceRepository;
import com.newsinsight.reliability.service.SourceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Worker runs against H2 with real transactions, where a rejected write must not cost the rest
 * of its domain.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReliabilityWorkerIntegrationTest {

    private static final String BLOOD = "Blood";
    private static final String CHEST = "Chest";
    private static final LocalDate JUNE_14 = LocalDate.of(2024, 6, 14);
    private static final LocalDate JUNE_15 = LocalDate.of(2024, 6, 15);

    @Autowired
    private ReliabilityWorker worker;

    @Autowired
    private SourceRegistry sourceRegistry;

    @Autowired
    private EvidenceItemRepository evidenceRepository;

    @Autowired
    private ReliabilitySnapshotRepository snapshotRepository;

    @Autowired
    private SourceRepository sourceRepository;

    @BeforeEach
    void setUp() {
        snapshotRepository.deleteAll();
        evidenceRepository.deleteAll();
        sourceRepository.deleteAll();
        sourceRegistry.evict(BLOOD);
        sourceRegistry.evict(CHEST);

        List<EvidenceItem> items = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            items.add(evidence("B" + i, BLOOD, "Leukemia and lymphoma outcomes after chemotherapy in a cancer cohort."));
            items.add(evidence("C" + i, CHEST, "Lung tumor response to radiation in an oncology trial."));
        }
        evidenceRepository.saveAll(items);
    }

    private static EvidenceItem evidence(String externalId, String sourceName, String abstractText) {
        return EvidenceItem.builder()
                .externalId(externalId)
                .sourceName(sourceName)
                .domain("oncology")
                .publicationDate("2023")
                .title("Study " + externalId)
                .abstractText(abstractText)
                .build();
    }

    private WorkerRequest forcedOncologyRun(LocalDate date) {
        return new WorkerRequest(date, List.of("oncology"), Set.of(), true);
    }

    /**
     * Removes a source behind the registry's back, so its cached id now points at a missing row.
     */
    private void deleteSource(String name) {
        Source source = sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc(name).orElseThrow();
        List<ReliabilitySnapshot> rows = snapshotRepository.findAll().stream()
                .filter(row -> row.getSource().getId().equals(source.getId()))
                .toList();
        snapshotRepository.deleteAll(rows);
        sourceRepository.delete(source);
    }

    private List<ReliabilitySnapshot> rowsOn(LocalDate date) {
        return snapshotRepository.findAll().stream()
                .filter(row -> row.getSnapshotDate().equals(date))
                .toList();
    }

    @Test
    @DisplayName("A rejected snapshot write is counted while the rest of the domain commits")
    void rejectedWriteDoesNotRollBackDomain() {
        // given
        WorkerReport first = worker.run(forcedOncologyRun(JUNE_14));
        assertThat(first.computed()).isEqualTo(4);
        assertThat(first.errored()).isZero();
        Long bloodId = sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc(BLOOD).orElseThrow().getId();
        deleteSource(CHEST);

        // when
        WorkerReport second = worker.run(forcedOncologyRun(JUNE_15));

        // then
        assertThat(second.computed()).isEqualTo(2);
        assertThat(second.errored()).isEqualTo(2);
        assertThat(second.processedDomains()).containsExactly("oncology");
        assertThat(second.unprocessedDomains()).isEmpty();
        assertThat(rowsOn(JUNE_15))
                .hasSize(2)
                .allSatisfy(row -> assertThat(row.getSource().getId()).isEqualTo(bloodId));
    }

    @Test
    @DisplayName("A source whose write failed is looked up again on the next run")
    void failedWriteEvictsCachedSource() {
        // given
        worker.run(forcedOncologyRun(JUNE_14));
        deleteSource(CHEST);
        worker.run(forcedOncologyRun(JUNE_15));

        // when
        WorkerReport third = worker.run(forcedOncologyRun(JUNE_15));

        // then
        assertThat(third.computed()).isEqualTo(4);
        assertThat(third.errored()).isZero();
        assertThat(rowsOn(JUNE_15)).hasSize(4);
        assertThat(sourceRepository.findFirstByNameIgnoreCaseOrderByIdAsc(CHEST)).isPresent();
    }
}
