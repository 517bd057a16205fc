package com.newsinsight.reliability.entity;

import com.newsinsight.reliability.scoring.ScoreComponents;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One persisted composite scoring result per (source, domain, use case, date).
 *
 * Uniqueness of the composite key is enforced by {@code uq_snapshot_key}; the band column always
 * holds the band of the stored score.
 */
@Entity
@Table(name = "reliability_snapshots", uniqueConstraints = {
    @UniqueConstraint(name = "uq_snapshot_key",
            columnNames = {"source_id", "domain", "use_case", "snapshot_date"})
}, indexes = {
    @Index(name = "idx_snapshot_lookup", columnList = "domain, use_case, snapshot_date, score")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReliabilitySnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_id", nullable = false)
    @ToString.Exclude
    private Source source;

    @Column(name = "domain", nullable = false, length = 100)
    private String domain;

    @Enumerated(EnumType.STRING)
    @Column(name = "use_case", nullable = false, length = 20)
    private UseCase useCase;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    @Column(name = "score", nullable = false)
    private double score;

    @Enumerated(EnumType.STRING)
    @Column(name = "band", nullable = false, length = 20)
    private ReliabilityBand band;

    @Column(name = "authority", nullable = false)
    private double authority;

    @Column(name = "relevance", nullable = false)
    private double relevance;

    @Column(name = "freshness", nullable = false)
    private double freshness;

    @Column(name = "guideline", nullable = false)
    private double guideline;

    @Column(name = "rigor", nullable = false)
    private double rigor;

    @Enumerated(EnumType.STRING)
    @Column(name = "uncertainty", nullable = false, length = 20)
    private UncertaintyLevel uncertainty;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "reasons", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    @Column(name = "reference_impact_metric")
    private Double referenceImpactMetric;

    @Column(name = "version", nullable = false, length = 20)
    private String version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public ScoreComponents getComponents() {
        return new ScoreComponents(authority, relevance, freshness, guideline, rigor);
    }

    public void setComponents(ScoreComponents components) {
        this.authority = components.authority();
        this.relevance = components.relevance();
        this.freshness = components.freshness();
        this.guideline = components.guideline();
        this.rigor = components.rigor();
    }
}
